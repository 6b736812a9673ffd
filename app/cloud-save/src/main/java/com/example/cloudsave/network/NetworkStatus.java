/*
 * どこで: Cloud Save ネットワーク監視
 * 何を: ある時点の接続状態スナップショットを表す
 * なぜ: 購読者へ不変値として渡し、監視側の内部状態を共有しないため
 */
package com.example.cloudsave.network;

import java.time.Instant;

/**
 * @param probeReachable result of the last active probe, {@code null} when no probe ran since the
 *     last passive change
 */
public record NetworkStatus(
    boolean isOnline,
    ConnectionInfo connection,
    Instant lastOnline,
    Instant lastOffline,
    Boolean probeReachable) {

  NetworkStatus withOnline(boolean nextOnline, Instant now) {
    return new NetworkStatus(
        nextOnline,
        connection,
        nextOnline ? now : lastOnline,
        nextOnline ? lastOffline : now,
        probeReachable);
  }

  NetworkStatus withConnection(ConnectionInfo nextConnection) {
    return new NetworkStatus(isOnline, nextConnection, lastOnline, lastOffline, probeReachable);
  }

  NetworkStatus withProbeReachable(Boolean reachable) {
    return new NetworkStatus(isOnline, connection, lastOnline, lastOffline, reachable);
  }
}
