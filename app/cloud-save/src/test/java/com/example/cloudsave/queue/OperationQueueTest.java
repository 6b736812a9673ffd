/*
 * どこで: Cloud Save オフラインキューのユニットテスト
 * 何を: 容量制御・優先度順の実行・再試行と onError の回数・永続化からの復元を検証する
 * なぜ: 回線断や一時障害が続いてもセーブ操作が失われず二重通知もされないことを担保するため
 */
package com.example.cloudsave.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.cloudsave.config.CloudSaveProperties;
import com.example.cloudsave.error.CloudErrorCode;
import com.example.cloudsave.error.ErrorSeverity;
import com.example.cloudsave.error.OperationException;
import com.example.cloudsave.error.QueueCapacityException;
import com.example.cloudsave.metrics.CloudSaveMetrics;
import com.example.cloudsave.network.NetworkMonitor;
import com.example.cloudsave.network.NetworkStatus;
import com.example.cloudsave.support.MutableClock;
import com.example.common.event.Subscription;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

class OperationQueueTest {

  private static final Instant START = Instant.parse("2026-01-17T00:00:00Z");
  private static final Executor DIRECT = Runnable::run;

  private MutableClock clock;
  private TaskScheduler taskScheduler;
  private SimpleMeterRegistry meterRegistry;
  private InMemoryOperationQueueStore store;
  private ScriptedExecutor executor;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    taskScheduler = mock(TaskScheduler.class);
    meterRegistry = new SimpleMeterRegistry();
    store = new InMemoryOperationQueueStore();
    executor = new ScriptedExecutor(OperationType.SAVE, payload -> payload);
  }

  @Test
  void enqueueAndDequeueAreExact() {
    final OperationQueue queue = newQueue(properties(100, 3, false), null);

    final String first = queue.enqueue(OperationType.SAVE, TextNode.valueOf("a"), null);
    final String second =
        queue.enqueue(
            OperationType.LOAD,
            TextNode.valueOf("b"),
            EnqueueOptions.defaults().withMetadata(OperationMetadata.forSlot("user-1", 2)));

    assertThat(first).isNotEqualTo(second).startsWith("op_");
    assertThat(queue.getOperation(first)).get().extracting(QueuedOperationRecord::priority)
        .isEqualTo(OperationQueue.DEFAULT_PRIORITY);
    assertThat(queue.getOperationsByType(OperationType.LOAD))
        .extracting(QueuedOperationRecord::id)
        .containsExactly(second);
    assertThat(queue.getOperationsByOwner("user-1")).hasSize(1);
    assertThat(store.load()).hasSize(2);

    assertThat(queue.dequeue(first)).isTrue();
    assertThat(queue.dequeue(first)).isFalse();
    assertThat(queue.getOperation(first)).isEmpty();
    assertThat(queue.getStatus().totalOperations()).isEqualTo(1);
    assertThat(store.load()).extracting(QueuedOperationRecord::id).containsExactly(second);
  }

  @Test
  void enqueueRejectsMaxRetriesBelowOne() {
    final OperationQueue queue = newQueue(properties(100, 3, false), null);

    assertThatThrownBy(
            () ->
                queue.enqueue(
                    OperationType.SAVE, TextNode.valueOf("a"), EnqueueOptions.defaults().withMaxRetries(0)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void fullQueueEvictsOldestLowPriorityOperationWithoutOnError() {
    final OperationQueue queue = newQueue(properties(3, 3, false), null);
    final AtomicInteger evictedErrors = new AtomicInteger();
    queue.enqueue(OperationType.SAVE, TextNode.valueOf("p5"), EnqueueOptions.defaults().withPriority(5));
    queue.enqueue(OperationType.SAVE, TextNode.valueOf("p9"), EnqueueOptions.defaults().withPriority(9));
    final String low =
        queue.enqueue(
            OperationType.SAVE,
            TextNode.valueOf("p1"),
            EnqueueOptions.defaults()
                .withPriority(1)
                .withCallbacks(OperationCallbacks.of(null, error -> evictedErrors.incrementAndGet())));

    final String added =
        queue.enqueue(OperationType.SAVE, TextNode.valueOf("new"), EnqueueOptions.defaults().withPriority(5));

    assertThat(queue.getOperation(low)).isEmpty();
    assertThat(queue.getOperation(added)).isPresent();
    assertThat(queue.getStatus().totalOperations()).isEqualTo(3);
    assertThat(evictedErrors.get()).isZero();
    assertThat(meterRegistry.get("cloud_save.queue.evicted.total").counter().count()).isEqualTo(1.0d);
  }

  @Test
  void fullQueueWithoutEvictableOperationThrows() {
    final OperationQueue queue = newQueue(properties(2, 3, false), null);
    queue.enqueue(OperationType.SAVE, TextNode.valueOf("a"), EnqueueOptions.defaults().withPriority(2));
    queue.enqueue(OperationType.SAVE, TextNode.valueOf("b"), EnqueueOptions.defaults().withPriority(5));

    assertThatThrownBy(() -> queue.enqueue(OperationType.SAVE, TextNode.valueOf("c"), null))
        .isInstanceOf(QueueCapacityException.class);
    assertThat(queue.getStatus().totalOperations()).isEqualTo(2);
  }

  @Test
  void processQueueDispatchesByPriorityThenAge() {
    final OperationQueue queue = newQueue(properties(100, 3, false), null);
    queue.enqueue(OperationType.SAVE, TextNode.valueOf("low"), EnqueueOptions.defaults().withPriority(1));
    clock.advance(Duration.ofMillis(1));
    queue.enqueue(OperationType.SAVE, TextNode.valueOf("high"), EnqueueOptions.defaults().withPriority(9));
    clock.advance(Duration.ofMillis(1));
    queue.enqueue(OperationType.SAVE, TextNode.valueOf("mid-old"), null);
    clock.advance(Duration.ofMillis(1));
    queue.enqueue(OperationType.SAVE, TextNode.valueOf("mid-new"), null);

    final DrainOutcome outcome = queue.processQueue().join();

    assertThat(executor.seenPayloads()).containsExactly("high", "mid-old", "mid-new", "low");
    assertThat(outcome.dispatched()).isEqualTo(4);
    assertThat(outcome.succeeded()).isEqualTo(4);
    assertThat(queue.getStatus().totalOperations()).isZero();
    assertThat(store.load()).isEmpty();
  }

  @Test
  void successInvokesOnSuccessWithExecutorResult() {
    final OperationQueue queue = newQueue(properties(100, 3, false), null);
    final AtomicReference<JsonNode> result = new AtomicReference<>();
    final List<OperationProgress> progress = new ArrayList<>();
    queue.enqueue(
        OperationType.SAVE,
        IntNode.valueOf(7),
        EnqueueOptions.defaults()
            .withCallbacks(
                new OperationCallbacks() {
                  @Override
                  public void onSuccess(JsonNode value) {
                    result.set(value);
                  }

                  @Override
                  public void onProgress(OperationProgress value) {
                    progress.add(value);
                  }
                }));

    queue.processQueue().join();

    assertThat(result.get()).isEqualTo(IntNode.valueOf(7));
    assertThat(progress).extracting(OperationProgress::completedSteps).containsExactly(0, 1);
  }

  @Test
  void retryableFailuresCallOnErrorExactlyOnceAfterMaxRetries() {
    executor = new ScriptedExecutor(OperationType.SAVE, payload -> {
      throw OperationException.retryable(CloudErrorCode.NETWORK_TIMEOUT, "timed out");
    });
    final OperationQueue queue = newQueue(properties(100, 3, false), null);
    final List<OperationException> errors = new ArrayList<>();
    final String id =
        queue.enqueue(
            OperationType.SAVE,
            TextNode.valueOf("save"),
            EnqueueOptions.defaults().withCallbacks(OperationCallbacks.of(null, errors::add)));

    final DrainOutcome first = queue.processQueue().join();
    final QueuedOperationRecord afterFirst = queue.getOperation(id).orElseThrow();
    assertThat(first.retried()).isEqualTo(1);
    assertThat(afterFirst.retryCount()).isEqualTo(1);
    assertThat(afterFirst.nextAttemptAt()).isEqualTo(START.plusSeconds(1));
    assertThat(afterFirst.lastError()).isEqualTo("timed out");

    // バックオフ中は選択されない
    assertThat(queue.processQueue().join().dispatched()).isZero();

    clock.advance(Duration.ofSeconds(1));
    queue.processQueue().join();
    assertThat(queue.getOperation(id).orElseThrow().nextAttemptAt())
        .isEqualTo(START.plusSeconds(1).plusSeconds(2));

    clock.advance(Duration.ofSeconds(2));
    final DrainOutcome last = queue.processQueue().join();

    assertThat(last.failed()).isEqualTo(1);
    assertThat(queue.getOperation(id)).isEmpty();
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).code()).isEqualTo(CloudErrorCode.NETWORK_TIMEOUT);
    assertThat(executor.calls()).isEqualTo(3);

    clock.advance(Duration.ofMinutes(5));
    queue.processQueue().join();
    assertThat(errors).hasSize(1);
  }

  @Test
  void nonRetryableFailureExhaustsImmediately() {
    executor = new ScriptedExecutor(OperationType.SAVE, payload -> {
      throw OperationException.nonRetryable(CloudErrorCode.DATA_INVALID, ErrorSeverity.MEDIUM, "bad data");
    });
    final OperationQueue queue = newQueue(properties(100, 5, false), null);
    final List<OperationException> errors = new ArrayList<>();
    final String id =
        queue.enqueue(
            OperationType.SAVE,
            TextNode.valueOf("save"),
            EnqueueOptions.defaults().withCallbacks(OperationCallbacks.of(null, errors::add)));

    final DrainOutcome outcome = queue.processQueue().join();

    assertThat(outcome.failed()).isEqualTo(1);
    assertThat(executor.calls()).isEqualTo(1);
    assertThat(errors).singleElement().satisfies(error -> assertThat(error.retryable()).isFalse());
    assertThat(queue.getOperation(id)).isEmpty();
    verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
  }

  @Test
  void retryableFailureSchedulesRedrainAtBackoffGate() {
    executor = new ScriptedExecutor(OperationType.SAVE, payload -> {
      throw new IllegalStateException("network unreachable");
    });
    final OperationQueue queue = newQueue(properties(100, 3, false), null);
    queue.enqueue(OperationType.SAVE, TextNode.valueOf("save"), null);

    queue.processQueue().join();

    verify(taskScheduler).schedule(any(Runnable.class), eq(START.plusSeconds(1)));
  }

  @Test
  void computeBackoffDurationDoublesUpToCap() {
    final OperationQueue queue = newQueue(properties(100, 3, false), null);

    assertThat(queue.computeBackoffDuration(1)).isEqualTo(Duration.ofSeconds(1));
    assertThat(queue.computeBackoffDuration(2)).isEqualTo(Duration.ofSeconds(2));
    assertThat(queue.computeBackoffDuration(3)).isEqualTo(Duration.ofSeconds(4));
    assertThat(queue.computeBackoffDuration(6)).isEqualTo(Duration.ofSeconds(30));
    assertThat(queue.computeBackoffDuration(40)).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void processQueueIsSkippedWhileOffline() {
    final NetworkMonitor monitor = mock(NetworkMonitor.class);
    when(monitor.isOnline()).thenReturn(false);
    final OperationQueue queue = newQueue(properties(100, 3, true), monitor);
    queue.enqueue(OperationType.SAVE, TextNode.valueOf("save"), null);

    final DrainOutcome outcome = queue.processQueue().join();

    assertThat(outcome.skipped()).isTrue();
    assertThat(outcome.skipReason()).isEqualTo(DrainOutcome.SKIPPED_OFFLINE);
    assertThat(executor.calls()).isZero();
    assertThat(queue.getStatus().pendingOperations()).isEqualTo(1);
  }

  @Test
  void networkRestoreDrainsPendingOperations() {
    final NetworkMonitor monitor = mock(NetworkMonitor.class);
    final AtomicReference<Consumer<? super NetworkStatus>> listener = new AtomicReference<>();
    when(monitor.isOnline()).thenReturn(false);
    when(monitor.addListener(any()))
        .thenAnswer(
            invocation -> {
              listener.set(invocation.getArgument(0));
              return (Subscription) () -> listener.set(null);
            });
    final OperationQueue queue = newQueue(properties(100, 3, true), monitor);
    queue.start();
    queue.enqueue(OperationType.SAVE, TextNode.valueOf("save"), null);
    assertThat(executor.calls()).isZero();

    when(monitor.isOnline()).thenReturn(true);
    listener.get().accept(new NetworkStatus(true, null, START, null, null));

    assertThat(executor.calls()).isEqualTo(1);
    assertThat(queue.getStatus().totalOperations()).isZero();
  }

  @Test
  void concurrentProcessQueueCallsShareOneDrain() {
    final Deque<Runnable> pendingDrains = new ArrayDeque<>();
    final OperationQueue queue =
        new OperationQueue(
            properties(100, 3, false),
            true,
            store,
            new OperationExecutorRegistry(List.of(executor)),
            null,
            taskScheduler,
            pendingDrains::add,
            DIRECT,
            clock,
            new CloudSaveMetrics(meterRegistry));
    queue.enqueue(OperationType.SAVE, TextNode.valueOf("save"), null);

    final CompletableFuture<DrainOutcome> first = queue.processQueue();
    final CompletableFuture<DrainOutcome> second = queue.processQueue();

    assertThat(second).isSameAs(first);
    assertThat(queue.getStatus().isProcessing()).isTrue();
    assertThat(pendingDrains).hasSize(1);

    pendingDrains.poll().run();

    assertThat(first).isCompleted();
    assertThat(first.join().succeeded()).isEqualTo(1);
    assertThat(queue.getStatus().isProcessing()).isFalse();
  }

  @Test
  void restoredOperationsRunWithoutCallbacksOnStart() {
    store.save(
        List.of(
            persisted("op_restored_1", 0, null),
            persisted("op_restored_2", 1, START.minusSeconds(5))));
    final OperationQueue queue = newQueue(properties(100, 3, true), null);

    queue.start();

    assertThat(executor.seenPayloads()).containsExactlyInAnyOrder("op_restored_1", "op_restored_2");
    assertThat(queue.getStatus().totalOperations()).isZero();
    assertThat(store.load()).isEmpty();
  }

  @Test
  void restoredSnapshotLargerThanCapacityIsCutBackOnStart() {
    store.save(
        List.of(
            persistedAt("op_p5_a", 5, START.minusSeconds(50)),
            persistedAt("op_p1", 1, START.minusSeconds(40)),
            persistedAt("op_p5_b", 5, START.minusSeconds(30)),
            persistedAt("op_p5_c", 5, START.minusSeconds(20)),
            persistedAt("op_p5_d", 5, START.minusSeconds(10))));
    final OperationQueue queue = newQueue(properties(3, 3, false), null);

    queue.start();

    assertThat(queue.getStatus().totalOperations()).isEqualTo(3);
    assertThat(queue.getOperations())
        .extracting(QueuedOperationRecord::id)
        .containsExactly("op_p5_a", "op_p5_b", "op_p5_c");
    assertThat(store.load()).hasSize(3);
    assertThat(meterRegistry.get("cloud_save.queue.evicted.total").counter().count()).isEqualTo(2.0d);
    assertThat(executor.calls()).isZero();
  }

  @Test
  void drainRunsAtMostProcessingConcurrencyOperationsAtOnce() throws Exception {
    final AtomicInteger active = new AtomicInteger();
    final AtomicInteger maxActive = new AtomicInteger();
    final List<String> started = Collections.synchronizedList(new ArrayList<>());
    final OperationExecutor slow =
        new OperationExecutor() {
          @Override
          public OperationType type() {
            return OperationType.SAVE;
          }

          @Override
          public JsonNode execute(JsonNode payload, OperationMetadata metadata) {
            started.add(payload.asText());
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
              Thread.sleep(100);
            } catch (InterruptedException ex) {
              Thread.currentThread().interrupt();
              throw new IllegalStateException(ex);
            } finally {
              active.decrementAndGet();
            }
            return payload;
          }
        };
    final ExecutorService drainPool = Executors.newSingleThreadExecutor();
    final ExecutorService operationPool = Executors.newFixedThreadPool(6);
    try {
      final OperationQueue queue =
          new OperationQueue(
              properties(100, 3, false, 2),
              true,
              store,
              new OperationExecutorRegistry(List.of(slow)),
              null,
              taskScheduler,
              drainPool,
              operationPool,
              clock,
              new CloudSaveMetrics(meterRegistry));
      for (int priority : new int[] {3, 9, 5, 1, 7, 4}) {
        queue.enqueue(
            OperationType.SAVE,
            TextNode.valueOf("p" + priority),
            EnqueueOptions.defaults().withPriority(priority));
      }

      final DrainOutcome outcome = queue.processQueue().get(5, TimeUnit.SECONDS);

      assertThat(outcome.dispatched()).isEqualTo(6);
      assertThat(outcome.succeeded()).isEqualTo(6);
      assertThat(maxActive.get()).isEqualTo(2);
      // 同じ枠で並走する 2 件の開始順は前後しうる
      assertThat(started.subList(0, 2)).containsExactlyInAnyOrder("p9", "p7");
      assertThat(started.subList(2, 4)).containsExactlyInAnyOrder("p5", "p4");
      assertThat(started.subList(4, 6)).containsExactlyInAnyOrder("p3", "p1");
      assertThat(queue.getStatus().totalOperations()).isZero();
    } finally {
      drainPool.shutdownNow();
      operationPool.shutdownNow();
    }
  }

  @Test
  void retryFailedResetsExhaustedOperationsAndClearFailedRemovesThem() {
    store.save(List.of(persisted("op_exhausted_1", 3, null), persisted("op_exhausted_2", 3, null)));
    final OperationQueue queue = newQueue(properties(100, 3, false), null);
    queue.start();
    assertThat(queue.getStatus().failedOperations()).isEqualTo(2);

    assertThat(queue.retryFailed()).isEqualTo(2);
    // retryFailed はオンライン時に即座に排出する
    assertThat(executor.calls()).isEqualTo(2);
    assertThat(queue.getStatus().totalOperations()).isZero();

    store.save(List.of(persisted("op_exhausted_3", 3, null)));
    final OperationQueue reloaded = newQueue(properties(100, 3, false), null);
    reloaded.start();
    assertThat(reloaded.clearFailed()).isEqualTo(1);
    assertThat(reloaded.getStatus().totalOperations()).isZero();
  }

  @Test
  void persistFailureKeepsQueueUsable() {
    final OperationQueueStore failingStore = mock(OperationQueueStore.class);
    when(failingStore.load()).thenReturn(List.of());
    doThrow(new OperationQueueStoreException("disk full", null))
        .when(failingStore)
        .save(any());
    final OperationQueue queue =
        new OperationQueue(
            properties(100, 3, false),
            true,
            failingStore,
            new OperationExecutorRegistry(List.of(executor)),
            null,
            taskScheduler,
            DIRECT,
            DIRECT,
            clock,
            new CloudSaveMetrics(meterRegistry));

    final String id = queue.enqueue(OperationType.SAVE, TextNode.valueOf("save"), null);

    assertThat(queue.getOperation(id)).isPresent();
    assertThat(meterRegistry.get("cloud_save.queue.persist.failure.total").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void unregisteredTypeFailsWithoutRetry() {
    final OperationQueue queue = newQueue(properties(100, 3, false), null);
    final List<OperationException> errors = new ArrayList<>();
    queue.enqueue(
        OperationType.SYNC,
        TextNode.valueOf("sync"),
        EnqueueOptions.defaults().withCallbacks(OperationCallbacks.of(null, errors::add)));

    queue.processQueue().join();

    assertThat(errors).singleElement()
        .satisfies(error -> assertThat(error.code()).isEqualTo(CloudErrorCode.OPERATION_FAILED));
  }

  @Test
  void shutdownKeepsSnapshotWhileDestroyRemovesIt() {
    final OperationQueue kept = newQueue(properties(100, 3, false), null);
    kept.enqueue(OperationType.SAVE, TextNode.valueOf("save"), null);
    kept.shutdown();
    assertThat(store.load()).hasSize(1);
    assertThat(kept.processQueue().join().skipReason()).isEqualTo(DrainOutcome.SKIPPED_DESTROYED);

    final OperationQueue destroyed = newQueue(properties(100, 3, false), null);
    destroyed.start();
    destroyed.destroy();
    assertThat(store.load()).isEmpty();
    assertThatThrownBy(() -> destroyed.enqueue(OperationType.SAVE, TextNode.valueOf("x"), null))
        .isInstanceOf(IllegalStateException.class);
  }

  private OperationQueue newQueue(CloudSaveProperties.Queue properties, NetworkMonitor monitor) {
    return new OperationQueue(
        properties,
        true,
        store,
        new OperationExecutorRegistry(List.of(executor)),
        monitor,
        taskScheduler,
        DIRECT,
        DIRECT,
        clock,
        new CloudSaveMetrics(meterRegistry));
  }

  private static CloudSaveProperties.Queue properties(
      int maxQueueSize, int maxRetries, boolean autoProcessOnline) {
    return properties(maxQueueSize, maxRetries, autoProcessOnline, 1);
  }

  private static CloudSaveProperties.Queue properties(
      int maxQueueSize, int maxRetries, boolean autoProcessOnline, int processingConcurrency) {
    return new CloudSaveProperties.Queue(
        maxQueueSize,
        maxRetries,
        Duration.ofSeconds(1),
        Duration.ofSeconds(30),
        processingConcurrency,
        autoProcessOnline,
        false,
        null);
  }

  private static QueuedOperationRecord persisted(String id, int retryCount, Instant nextAttemptAt) {
    return new QueuedOperationRecord(
        id,
        OperationType.SAVE,
        START.minusSeconds(60),
        retryCount,
        3,
        OperationQueue.DEFAULT_PRIORITY,
        TextNode.valueOf(id),
        OperationMetadata.forOwner("user-1"),
        nextAttemptAt,
        null);
  }

  private static QueuedOperationRecord persistedAt(String id, int priority, Instant createdAt) {
    return new QueuedOperationRecord(
        id,
        OperationType.SAVE,
        createdAt,
        0,
        3,
        priority,
        TextNode.valueOf(id),
        OperationMetadata.forOwner("user-1"),
        null,
        null);
  }

  private static final class ScriptedExecutor implements OperationExecutor {

    private final OperationType type;
    private final Function<JsonNode, JsonNode> behavior;
    private final List<String> seen = new ArrayList<>();

    private ScriptedExecutor(OperationType type, Function<JsonNode, JsonNode> behavior) {
      this.type = type;
      this.behavior = behavior;
    }

    @Override
    public OperationType type() {
      return type;
    }

    @Override
    public synchronized JsonNode execute(JsonNode payload, OperationMetadata metadata) {
      seen.add(payload.isTextual() ? payload.asText() : payload.toString());
      final JsonNode result = behavior.apply(payload);
      return result == null ? JsonNodeFactory.instance.nullNode() : result;
    }

    synchronized List<String> seenPayloads() {
      return List.copyOf(seen);
    }

    synchronized int calls() {
      return seen.size();
    }
  }
}
