package com.example.cloudsave.api.response;

import com.example.cloudsave.network.ConnectionInfo;
import com.example.cloudsave.network.ConnectionQuality;
import com.example.cloudsave.network.NetworkMonitor;
import com.example.cloudsave.network.NetworkStatistics;
import com.example.cloudsave.network.NetworkStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NetworkStatusResponse(
    boolean online,
    String connectionType,
    String effectiveType,
    double downlinkMbps,
    long rttMillis,
    boolean saveData,
    Boolean probeReachable,
    Instant lastOnline,
    Instant lastOffline,
    ConnectionQuality quality,
    boolean suitableForCloudOperations,
    long totalOnlineSeconds,
    long totalOfflineSeconds,
    int connectionSwitches) {

  public static NetworkStatusResponse from(NetworkMonitor monitor) {
    final NetworkStatus status = monitor.getStatus();
    final ConnectionInfo connection = status.connection();
    final NetworkStatistics statistics = monitor.getStatistics();
    return new NetworkStatusResponse(
        status.isOnline(),
        connection.connectionType().value(),
        connection.effectiveType().value(),
        connection.downlinkMbps(),
        connection.rttMillis(),
        connection.saveData(),
        status.probeReachable(),
        status.lastOnline(),
        status.lastOffline(),
        monitor.getConnectionQuality(),
        monitor.isSuitableForCloudOperations(),
        statistics.totalOnlineTime().toSeconds(),
        statistics.totalOfflineTime().toSeconds(),
        statistics.connectionSwitches());
  }
}
