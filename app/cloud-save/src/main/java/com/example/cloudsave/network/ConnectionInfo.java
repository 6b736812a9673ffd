package com.example.cloudsave.network;

/**
 * Passive link description supplied by the host.
 *
 * @param downlinkMbps estimated downlink bandwidth in Mbit/s, 0 when unknown
 * @param rttMillis estimated round trip time in milliseconds, 0 when unknown
 * @param saveData the user asked to reduce data usage
 */
public record ConnectionInfo(
    ConnectionType connectionType,
    EffectiveConnectionType effectiveType,
    double downlinkMbps,
    long rttMillis,
    boolean saveData) {

  public ConnectionInfo {
    connectionType = connectionType == null ? ConnectionType.UNKNOWN : connectionType;
    effectiveType = effectiveType == null ? EffectiveConnectionType.UNKNOWN : effectiveType;
  }

  public static ConnectionInfo unknown() {
    return new ConnectionInfo(ConnectionType.UNKNOWN, EffectiveConnectionType.UNKNOWN, 0, 0, false);
  }
}
