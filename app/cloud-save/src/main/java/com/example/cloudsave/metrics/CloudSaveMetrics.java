/*
 * どこで: Cloud Save 計測
 * 何を: キュー操作の結果/バックログ/退避件数とネットワーク遷移/プローブ遅延を記録する
 * なぜ: オフライン時の滞留と再試行の状況をメトリクスから直接観測できるようにするため
 */
package com.example.cloudsave.metrics;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class CloudSaveMetrics {

  private static final String METRIC_OPERATION_TOTAL = "cloud_save.operation.total";
  private static final String METRIC_QUEUE_BACKLOG = "cloud_save.queue.backlog";
  private static final String METRIC_QUEUE_EVICTED = "cloud_save.queue.evicted.total";
  private static final String METRIC_QUEUE_PERSIST_FAILURE = "cloud_save.queue.persist.failure.total";
  private static final String METRIC_NETWORK_TRANSITION = "cloud_save.network.transition.total";
  private static final String METRIC_NETWORK_PROBE = "cloud_save.network.probe";
  private static final String METRIC_INITIALIZATION = "cloud_save.initialization.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter evictedCounter;
  private final Counter persistFailureCounter;

  public CloudSaveMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_QUEUE_BACKLOG, backlogCurrent, AtomicInteger::get)
        .description("Current number of queued cloud save operations")
        .register(meterRegistry);
    this.evictedCounter =
        Counter.builder(METRIC_QUEUE_EVICTED)
            .description("Low priority operations evicted because the queue was full")
            .register(meterRegistry);
    this.persistFailureCounter =
        Counter.builder(METRIC_QUEUE_PERSIST_FAILURE)
            .description("Failed writes of the persisted queue snapshot")
            .register(meterRegistry);
  }

  public void recordOperationResult(String type, String result) {
    counter(METRIC_OPERATION_TOTAL, "Cloud save operation outcomes", Tags.of("type", type, "result", result))
        .increment();
  }

  public void updateBacklog(int size) {
    backlogCurrent.set(Math.max(size, 0));
  }

  public void recordEviction() {
    evictedCounter.increment();
  }

  public void recordPersistFailure() {
    persistFailureCounter.increment();
  }

  public void recordNetworkTransition(boolean online) {
    counter(
            METRIC_NETWORK_TRANSITION,
            "Observed online/offline transitions",
            Tags.of("state", online ? "online" : "offline"))
        .increment();
  }

  public void recordProbe(boolean reachable, Duration elapsed) {
    Timer.builder(METRIC_NETWORK_PROBE)
        .description("Active connectivity probe latency")
        .tags(Tags.of("result", reachable ? "reachable" : "unreachable"))
        .register(meterRegistry)
        .record(elapsed);
  }

  public void recordInitialization(String result) {
    counter(METRIC_INITIALIZATION, "Cloud save initialization outcomes", Tags.of("result", result))
        .increment();
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        name + tags,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
