/*
 * どこで: Cloud Save ネットワーク監視
 * 何を: 受動シグナルと能動プローブを統合して接続状態を保持し、遷移を購読者へ通知する
 * なぜ: オフラインキューの排出可否と、クラウド操作に適した回線かどうかを一箇所で判断するため
 */
package com.example.cloudsave.network;

import com.example.cloudsave.config.CloudSaveProperties;
import com.example.cloudsave.metrics.CloudSaveMetrics;
import com.example.common.event.ListenerRegistry;
import com.example.common.event.Subscription;
import com.example.common.time.Sleeper;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Connectivity state machine.
 *
 * <p>Precedence between the two signals: a passive offline signal always wins. While passively
 * online, a failed probe cycle flips the monitor offline and a successful one flips it back online.
 * A probe is never run while passively offline, so a probe success cannot override it.
 *
 * <p>Listeners are notified once per genuine online/offline transition and when the host reports
 * changed link details. They are not called on subscribe.
 */
public class NetworkMonitor {

  private static final Logger logger = LoggerFactory.getLogger(NetworkMonitor.class);

  private final CloudSaveProperties.Network properties;
  private final PassiveConnectivitySource passiveSource;
  private final ConnectivityProbe probe;
  private final TaskScheduler taskScheduler;
  private final Sleeper sleeper;
  private final Clock clock;
  private final CloudSaveMetrics metrics;
  private final ListenerRegistry<NetworkStatus> listeners =
      new ListenerRegistry<>("network-status");
  private final Instant sessionStartedAt;

  private NetworkStatus status;
  private boolean passiveOnline;
  private Instant stateSince;
  private Duration accumulatedOnline = Duration.ZERO;
  private Duration accumulatedOffline = Duration.ZERO;
  private int transitions;
  private ScheduledFuture<?> probeTask;
  private boolean destroyed;

  public NetworkMonitor(
      CloudSaveProperties.Network properties,
      PassiveConnectivitySource passiveSource,
      ConnectivityProbe probe,
      TaskScheduler taskScheduler,
      Sleeper sleeper,
      Clock clock,
      CloudSaveMetrics metrics) {
    this.properties = properties;
    this.passiveSource = passiveSource;
    this.probe = probe;
    this.taskScheduler = taskScheduler;
    this.sleeper = sleeper;
    this.clock = clock;
    this.metrics = metrics;
    final Instant now = clock.instant();
    this.sessionStartedAt = now;
    this.stateSince = now;
    this.passiveOnline = passiveSource.isOnline();
    final ConnectionInfo connection =
        properties.enableDetailedInfo() ? passiveSource.connectionInfo() : ConnectionInfo.unknown();
    this.status =
        new NetworkStatus(
            passiveOnline, connection, passiveOnline ? now : null, passiveOnline ? null : now, null);
  }

  /** Schedules the periodic probe. A zero {@code ping-interval} disables it. */
  public synchronized void start() {
    if (destroyed || probeTask != null) {
      return;
    }
    final Duration interval = properties.pingInterval();
    if (interval.isZero()) {
      logger.info("periodic connectivity probe disabled");
      return;
    }
    probeTask =
        taskScheduler.scheduleWithFixedDelay(
            this::runScheduledCheck, clock.instant().plus(interval), interval);
    logger.info(
        "network monitor started online={} intervalMs={}", status.isOnline(), interval.toMillis());
  }

  public synchronized NetworkStatus getStatus() {
    return status;
  }

  public boolean isOnline() {
    return getStatus().isOnline();
  }

  public boolean isOffline() {
    return !isOnline();
  }

  /**
   * Runs one probe cycle (up to {@code retry-attempts} attempts with growing backoff) and applies
   * the result.
   *
   * @return whether the remote endpoint was reachable
   */
  public boolean checkConnectivity() {
    synchronized (this) {
      if (destroyed) {
        return status.isOnline();
      }
    }
    if (!passiveSource.isOnline()) {
      onPassiveOffline();
      return false;
    }
    synchronized (this) {
      passiveOnline = true;
    }
    final boolean reachable = probeWithRetries();
    applyProbeResult(reachable);
    return reachable;
  }

  public ConnectionQuality getConnectionQuality() {
    return qualityOf(getStatus());
  }

  public boolean isSuitableForCloudOperations() {
    final NetworkStatus current = getStatus();
    if (!current.isOnline() || Boolean.FALSE.equals(current.probeReachable())) {
      return false;
    }
    if (current.connection().saveData()) {
      return false;
    }
    return qualityOf(current).isSuitableForCloudOperations();
  }

  public Subscription addListener(Consumer<? super NetworkStatus> listener) {
    return listeners.subscribe(listener);
  }

  public boolean removeListener(Consumer<? super NetworkStatus> listener) {
    return listeners.unsubscribe(listener);
  }

  /** Passive "online" signal from the host. Clears the last probe result. */
  public void onPassiveOnline() {
    final NetworkStatus changed;
    synchronized (this) {
      if (destroyed) {
        return;
      }
      passiveOnline = true;
      status = status.withProbeReachable(null);
      if (properties.enableDetailedInfo()) {
        status = status.withConnection(passiveSource.connectionInfo());
      }
      changed = status.isOnline() ? null : transitionLocked(true);
    }
    publishTransition(changed);
  }

  /** Passive "offline" signal from the host. Wins over any probe result. */
  public void onPassiveOffline() {
    final NetworkStatus changed;
    synchronized (this) {
      if (destroyed) {
        return;
      }
      passiveOnline = false;
      status = status.withProbeReachable(null);
      changed = status.isOnline() ? transitionLocked(false) : null;
    }
    publishTransition(changed);
  }

  public void updateConnectionInfo(ConnectionInfo connection) {
    final NetworkStatus changed;
    synchronized (this) {
      if (destroyed || connection == null || connection.equals(status.connection())) {
        return;
      }
      status = status.withConnection(connection);
      changed = status;
    }
    logger.debug(
        "connection info updated type={} effectiveType={}",
        connection.connectionType().value(),
        connection.effectiveType().value());
    listeners.publish(changed);
  }

  public synchronized NetworkStatistics getStatistics() {
    final Instant now = clock.instant();
    final Duration currentSegment = Duration.between(stateSince, now);
    final Duration online =
        status.isOnline() ? accumulatedOnline.plus(currentSegment) : accumulatedOnline;
    final Duration offline =
        status.isOnline() ? accumulatedOffline : accumulatedOffline.plus(currentSegment);
    return new NetworkStatistics(
        online, offline, Duration.between(sessionStartedAt, now), transitions);
  }

  public void destroy() {
    synchronized (this) {
      if (destroyed) {
        return;
      }
      destroyed = true;
      if (probeTask != null) {
        probeTask.cancel(false);
        probeTask = null;
      }
    }
    listeners.clear();
    logger.info("network monitor destroyed");
  }

  @VisibleForTesting
  static Duration computeProbeBackoff(Duration base, int attempt) {
    final int exponent = Math.max(0, Math.min(attempt - 1, 20));
    return base.multipliedBy(1L << exponent);
  }

  static ConnectionQuality qualityOf(NetworkStatus current) {
    if (!current.isOnline()) {
      return ConnectionQuality.POOR;
    }
    final ConnectionInfo connection = current.connection();
    final EffectiveConnectionType effectiveType = connection.effectiveType();
    final long rtt = connection.rttMillis();
    final double downlink = connection.downlinkMbps();
    if (effectiveType == EffectiveConnectionType.TYPE_4G && rtt < 100 && downlink > 10) {
      return ConnectionQuality.EXCELLENT;
    }
    if (effectiveType == EffectiveConnectionType.TYPE_4G && rtt < 200 && downlink > 5) {
      return ConnectionQuality.GOOD;
    }
    if (effectiveType == EffectiveConnectionType.TYPE_3G && rtt < 300) {
      return ConnectionQuality.FAIR;
    }
    if (effectiveType == EffectiveConnectionType.SLOW_2G
        || effectiveType == EffectiveConnectionType.TYPE_2G) {
      return ConnectionQuality.POOR;
    }
    return ConnectionQuality.UNKNOWN;
  }

  private void runScheduledCheck() {
    try {
      if (properties.enableDetailedInfo()) {
        updateConnectionInfo(passiveSource.connectionInfo());
      }
      checkConnectivity();
    } catch (RuntimeException ex) {
      logger.warn("scheduled connectivity check failed", ex);
    }
  }

  private boolean probeWithRetries() {
    final int attempts = properties.retryAttempts();
    for (int attempt = 1; attempt <= attempts; attempt++) {
      final long startedAt = System.nanoTime();
      boolean reachable;
      try {
        reachable = probe.isReachable();
      } catch (RuntimeException ex) {
        logger.debug("connectivity probe attempt failed attempt={} reason={}", attempt, ex.getMessage());
        reachable = false;
      }
      metrics.recordProbe(reachable, Duration.ofNanos(System.nanoTime() - startedAt));
      if (reachable) {
        return true;
      }
      if (attempt < attempts) {
        try {
          sleeper.sleep(computeProbeBackoff(properties.probeBackoffBase(), attempt));
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return false;
        }
      }
    }
    logger.warn("connectivity probe failed attempts={} url={}", attempts, properties.pingUrl());
    return false;
  }

  private void applyProbeResult(boolean reachable) {
    final NetworkStatus changed;
    synchronized (this) {
      if (destroyed) {
        return;
      }
      status = status.withProbeReachable(reachable);
      if (!reachable && status.isOnline()) {
        changed = transitionLocked(false);
      } else if (reachable && !status.isOnline() && passiveOnline) {
        changed = transitionLocked(true);
      } else {
        changed = null;
      }
    }
    publishTransition(changed);
  }

  // 呼び出し側でロックを保持していること
  private NetworkStatus transitionLocked(boolean online) {
    final Instant now = clock.instant();
    final Duration segment = Duration.between(stateSince, now);
    if (status.isOnline()) {
      accumulatedOnline = accumulatedOnline.plus(segment);
    } else {
      accumulatedOffline = accumulatedOffline.plus(segment);
    }
    stateSince = now;
    status = status.withOnline(online, now);
    transitions++;
    return status;
  }

  private void publishTransition(NetworkStatus changed) {
    if (changed == null) {
      return;
    }
    metrics.recordNetworkTransition(changed.isOnline());
    if (changed.isOnline()) {
      logger.info("network online connectionType={}", changed.connection().connectionType().value());
    } else {
      logger.warn("network offline probeReachable={}", changed.probeReachable());
    }
    listeners.publish(changed);
  }
}
