/*
 * どこで: Cloud Save オフラインキュー
 * 何を: クラウド操作を優先度付きで保持・永続化し、オンライン時に並列数を制限して実行する
 * なぜ: 回線断や一時障害があってもセーブ操作を失わず、指数バックオフで再試行するため
 */
package com.example.cloudsave.queue;

import com.example.cloudsave.config.CloudSaveProperties;
import com.example.cloudsave.error.ErrorSeverity;
import com.example.cloudsave.error.OperationException;
import com.example.cloudsave.error.QueueCapacityException;
import com.example.cloudsave.metrics.CloudSaveMetrics;
import com.example.cloudsave.network.NetworkMonitor;
import com.example.cloudsave.network.NetworkStatus;
import com.example.common.Ids;
import com.example.common.event.ListenerRegistry;
import com.example.common.event.Subscription;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.google.common.annotations.VisibleForTesting;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.TaskScheduler;

/**
 * Durable priority queue of cloud operations.
 *
 * <p>All bookkeeping happens under this object's monitor. Executors, callbacks and listeners are
 * always invoked without holding it.
 *
 * <p>Dispatch order is priority descending, then creation time, then id. At most {@code
 * processing-concurrency} operations run at once. A failed operation is retried after {@code
 * min(retry-delay * 2^(retryCount-1), max-retry-delay)} until {@code maxRetries} is reached; a
 * non-retryable failure exhausts it immediately. {@code onError} is called exactly once, when the
 * operation is removed as exhausted. Operations evicted for capacity are dropped without {@code
 * onError}.
 */
public class OperationQueue {

    private static final Logger logger = LoggerFactory.getLogger(OperationQueue.class);

    public static final int DEFAULT_PRIORITY = 5;
    static final int EVICTABLE_PRIORITY = 1;
    private static final int ERROR_MESSAGE_MAX_LENGTH = 500;
    private static final String MDC_OPERATION_ID = "operation_id";
    private static final String MDC_TRACE_ID = "trace_id";

    static final Comparator<QueuedOperationRecord> DISPATCH_ORDER =
            Comparator.comparingInt(QueuedOperationRecord::priority).reversed()
                    .thenComparing(QueuedOperationRecord::createdAt)
                    .thenComparing(QueuedOperationRecord::id);

    private static final Comparator<QueuedOperationRecord> AGE_ORDER =
            Comparator.comparing(QueuedOperationRecord::createdAt)
                    .thenComparing(QueuedOperationRecord::id);

    private final CloudSaveProperties.Queue properties;
    private final boolean autoRetry;
    private final OperationQueueStore store;
    private final OperationExecutorRegistry executors;
    @Nullable
    private final NetworkMonitor networkMonitor;
    private final TaskScheduler taskScheduler;
    private final Executor drainExecutor;
    private final Executor operationExecutor;
    private final Clock clock;
    private final CloudSaveMetrics metrics;
    private final ListenerRegistry<QueueStatus> statusListeners = new ListenerRegistry<>("queue-status");

    private final Map<String, QueuedOperationRecord> operations = new LinkedHashMap<>();
    private final Map<String, OperationCallbacks> callbacks = new HashMap<>();
    private final Set<String> inFlight = new HashSet<>();
    private final List<ScheduledFuture<?>> scheduledDrains = new ArrayList<>();
    private CompletableFuture<DrainOutcome> activeDrain;
    private boolean redrainRequested;
    private Subscription networkSubscription;
    private boolean started;
    private boolean destroyed;

    public OperationQueue(
            CloudSaveProperties.Queue properties,
            boolean autoRetry,
            OperationQueueStore store,
            OperationExecutorRegistry executors,
            @Nullable NetworkMonitor networkMonitor,
            TaskScheduler taskScheduler,
            Executor drainExecutor,
            Executor operationExecutor,
            Clock clock,
            CloudSaveMetrics metrics) {
        this.properties = properties;
        this.autoRetry = autoRetry;
        this.store = store;
        this.executors = executors;
        this.networkMonitor = networkMonitor;
        this.taskScheduler = taskScheduler;
        this.drainExecutor = drainExecutor;
        this.operationExecutor = operationExecutor;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Restores the persisted snapshot (without callbacks) and subscribes to network transitions.
     *
     * <p>A snapshot larger than {@code max-queue-size} is cut back on load: the oldest operations
     * with priority 1 or lower go first, then the operations last in dispatch order.
     */
    public void start() {
        final List<QueuedOperationRecord> restored = store.load();
        final List<QueuedOperationRecord> overflow;
        Instant earliestGate = null;
        synchronized (this) {
            if (destroyed || started) {
                return;
            }
            started = true;
            for (QueuedOperationRecord record : restored) {
                operations.putIfAbsent(record.id(), record);
            }
            overflow = trimToCapacityLocked();
            if (!overflow.isEmpty()) {
                persistLocked();
            }
            for (QueuedOperationRecord record : operations.values()) {
                if (record.nextAttemptAt() != null
                        && (earliestGate == null || record.nextAttemptAt().isBefore(earliestGate))) {
                    earliestGate = record.nextAttemptAt();
                }
            }
        }
        for (QueuedOperationRecord evicted : overflow) {
            metrics.recordEviction();
            logger.warn("restored offline queue over capacity, evicted operation id={} type={} priority={} maxQueueSize={}",
                    evicted.id(), evicted.type().value(), evicted.priority(), properties.maxQueueSize());
        }
        if (networkMonitor != null && properties.autoProcessOnline()) {
            final Subscription subscription = networkMonitor.addListener(this::onNetworkStatus);
            synchronized (this) {
                networkSubscription = subscription;
            }
        }
        logger.info("offline queue started restored={}", restored.size() - overflow.size());
        publishStatus();
        if (earliestGate != null && earliestGate.isAfter(clock.instant())) {
            scheduleRedrain(earliestGate);
        }
        if (!restored.isEmpty() && properties.autoProcessOnline() && isNetworkOnline()) {
            processQueue();
        }
    }

    public String enqueue(OperationType type, JsonNode payload, @Nullable EnqueueOptions options) {
        Objects.requireNonNull(type, "type");
        final EnqueueOptions effective = options == null ? EnqueueOptions.defaults() : options;
        final int maxRetries = effective.maxRetries() == null ? properties.maxRetries() : effective.maxRetries();
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        final int priority = effective.priority() == null ? DEFAULT_PRIORITY : effective.priority();

        final QueuedOperationRecord record;
        QueuedOperationRecord evicted = null;
        synchronized (this) {
            if (destroyed) {
                throw new IllegalStateException("offline queue is destroyed");
            }
            if (operations.size() >= properties.maxQueueSize()) {
                evicted = findEvictionCandidate();
                if (evicted == null) {
                    throw new QueueCapacityException(properties.maxQueueSize());
                }
                operations.remove(evicted.id());
                callbacks.remove(evicted.id());
            }
            record = new QueuedOperationRecord(
                    Ids.newOperationId(),
                    type,
                    clock.instant(),
                    0,
                    maxRetries,
                    priority,
                    payload == null ? NullNode.getInstance() : payload.deepCopy(),
                    effective.metadata(),
                    null,
                    null);
            operations.put(record.id(), record);
            if (effective.callbacks() != null) {
                callbacks.put(record.id(), effective.callbacks());
            }
            persistLocked();
        }
        if (evicted != null) {
            metrics.recordEviction();
            logger.warn("offline queue full, evicted operation id={} type={} priority={}",
                    evicted.id(), evicted.type().value(), evicted.priority());
        }
        logger.info("operation queued id={} type={} priority={}", record.id(), type.value(), priority);
        publishStatus();
        if (properties.autoProcessOnline() && isNetworkOnline()) {
            processQueue();
        }
        return record.id();
    }

    /** Removes a pending operation. An operation already running finishes but is not retried. */
    public boolean dequeue(String id) {
        final boolean removed;
        synchronized (this) {
            removed = operations.remove(id) != null;
            callbacks.remove(id);
            if (removed) {
                persistLocked();
            }
        }
        if (removed) {
            logger.info("operation dequeued id={}", id);
            publishStatus();
        }
        return removed;
    }

    public synchronized Optional<QueuedOperationRecord> getOperation(String id) {
        return Optional.ofNullable(operations.get(id));
    }

    public synchronized List<QueuedOperationRecord> getOperationsByType(OperationType type) {
        return operations.values().stream().filter(record -> record.type() == type).toList();
    }

    public synchronized List<QueuedOperationRecord> getOperationsByOwner(String ownerId) {
        return operations.values().stream()
                .filter(record -> Objects.equals(record.ownerId(), ownerId))
                .toList();
    }

    public synchronized List<QueuedOperationRecord> getOperations() {
        return operations.values().stream().sorted(DISPATCH_ORDER).toList();
    }

    public synchronized QueueStatus getStatus() {
        final Instant now = clock.instant();
        int processing = 0;
        int failed = 0;
        Instant nextAttemptAt = null;
        for (QueuedOperationRecord record : operations.values()) {
            if (inFlight.contains(record.id())) {
                processing++;
            } else if (record.isExhausted()) {
                failed++;
            } else if (record.nextAttemptAt() != null && record.nextAttemptAt().isAfter(now)
                    && (nextAttemptAt == null || record.nextAttemptAt().isBefore(nextAttemptAt))) {
                nextAttemptAt = record.nextAttemptAt();
            }
        }
        final int total = operations.size();
        return new QueueStatus(total, total - processing - failed, processing, failed, 0,
                activeDrain != null, nextAttemptAt);
    }

    /**
     * Drains every eligible operation once. While a drain is running the same future is returned;
     * while offline an already completed, skipped outcome is returned.
     */
    public CompletableFuture<DrainOutcome> processQueue() {
        final CompletableFuture<DrainOutcome> drain;
        synchronized (this) {
            if (destroyed) {
                return CompletableFuture.completedFuture(DrainOutcome.skipped(DrainOutcome.SKIPPED_DESTROYED));
            }
            if (activeDrain != null) {
                redrainRequested = true;
                return activeDrain;
            }
            if (!isNetworkOnline()) {
                logger.info("offline queue drain skipped because network is offline size={}", operations.size());
                return CompletableFuture.completedFuture(DrainOutcome.skipped(DrainOutcome.SKIPPED_OFFLINE));
            }
            drain = new CompletableFuture<>();
            activeDrain = drain;
        }
        publishStatus();
        try {
            drainExecutor.execute(() -> runDrain(drain));
        } catch (RejectedExecutionException ex) {
            logger.error("offline queue drain rejected", ex);
            finishDrain(drain, new DrainOutcome(false, null, 0, 0, 0, 0));
        }
        return drain;
    }

    /** Removes every operation. Running operations finish but their results are ignored. */
    public void clear() {
        final int removed;
        synchronized (this) {
            removed = operations.size();
            operations.clear();
            callbacks.clear();
            persistLocked();
        }
        logger.info("offline queue cleared removed={}", removed);
        publishStatus();
    }

    /** Removes operations that reached their retry limit without being dispatched again. */
    public int clearFailed() {
        final int removed;
        synchronized (this) {
            final List<String> failedIds = operations.values().stream()
                    .filter(record -> record.isExhausted() && !inFlight.contains(record.id()))
                    .map(QueuedOperationRecord::id)
                    .toList();
            failedIds.forEach(id -> {
                operations.remove(id);
                callbacks.remove(id);
            });
            removed = failedIds.size();
            if (removed > 0) {
                persistLocked();
            }
        }
        logger.info("failed operations cleared removed={}", removed);
        publishStatus();
        return removed;
    }

    /** Resets the retry count and backoff gate of failed operations and drains when online. */
    public int retryFailed() {
        final int reset;
        synchronized (this) {
            final List<QueuedOperationRecord> failed = operations.values().stream()
                    .filter(record -> record.isExhausted() && !inFlight.contains(record.id()))
                    .toList();
            failed.forEach(record -> operations.put(record.id(), record.withRetriesReset()));
            reset = failed.size();
            if (reset > 0) {
                persistLocked();
            }
        }
        logger.info("failed operations reset for retry count={}", reset);
        publishStatus();
        if (reset > 0 && isNetworkOnline()) {
            processQueue();
        }
        return reset;
    }

    /** The listener is not called on subscribe; use {@link #getStatus()} for the current state. */
    public Subscription addStatusListener(Consumer<? super QueueStatus> listener) {
        return statusListeners.subscribe(listener);
    }

    public boolean removeStatusListener(Consumer<? super QueueStatus> listener) {
        return statusListeners.unsubscribe(listener);
    }

    /** Stops processing and releases resources. The persisted snapshot is kept for the next start. */
    public void shutdown() {
        if (stop()) {
            logger.info("offline queue stopped");
        }
    }

    /** Stops processing and removes the persisted snapshot. */
    public void destroy() {
        if (!stop()) {
            return;
        }
        try {
            store.delete();
        } catch (OperationQueueStoreException ex) {
            logger.warn("failed to delete offline queue snapshot", ex);
        }
        logger.info("offline queue destroyed");
    }

    private boolean stop() {
        final Subscription subscription;
        final List<ScheduledFuture<?>> pending;
        synchronized (this) {
            if (destroyed) {
                return false;
            }
            destroyed = true;
            subscription = networkSubscription;
            networkSubscription = null;
            pending = new ArrayList<>(scheduledDrains);
            scheduledDrains.clear();
            operations.clear();
            callbacks.clear();
            inFlight.clear();
        }
        if (subscription != null) {
            subscription.unsubscribe();
        }
        pending.forEach(future -> future.cancel(false));
        statusListeners.clear();
        return true;
    }

    @VisibleForTesting
    Duration computeBackoffDuration(int retryCount) {
        final int exponent = Math.max(0, Math.min(retryCount - 1, 30));
        final long baseMillis = properties.retryDelay().toMillis();
        final long maxMillis = properties.maxRetryDelay().toMillis();
        final double exp = baseMillis * Math.pow(2, exponent);
        return Duration.ofMillis((long) Math.min(exp, maxMillis));
    }

    private void onNetworkStatus(NetworkStatus status) {
        if (!status.isOnline()) {
            return;
        }
        final boolean hasPending;
        synchronized (this) {
            hasPending = !operations.isEmpty();
        }
        if (hasPending) {
            logger.info("network restored, draining offline queue");
            processQueue();
        }
    }

    private void runDrain(CompletableFuture<DrainOutcome> drain) {
        MDC.put(MDC_TRACE_ID, Ids.newTraceId());
        DrainOutcome outcome = new DrainOutcome(false, null, 0, 0, 0, 0);
        try {
            final List<QueuedOperationRecord> selected = selectEligible();
            if (!selected.isEmpty()) {
                logger.info("processing offline queue eligible={}", selected.size());
            }
            final AtomicInteger succeeded = new AtomicInteger();
            final AtomicInteger retried = new AtomicInteger();
            final AtomicInteger failed = new AtomicInteger();
            final Semaphore slots = new Semaphore(properties.processingConcurrency());
            final List<CompletableFuture<Void>> running = new ArrayList<>();
            int dispatched = 0;
            for (QueuedOperationRecord record : selected) {
                slots.acquire();
                if (!markInFlight(record.id())) {
                    slots.release();
                    continue;
                }
                dispatched++;
                final String traceId = MDC.get(MDC_TRACE_ID);
                running.add(CompletableFuture
                        .runAsync(() -> processOperation(record.id(), traceId, succeeded, retried, failed),
                                operationExecutor)
                        .whenComplete((ignored, error) -> slots.release()));
            }
            CompletableFuture.allOf(running.toArray(new CompletableFuture<?>[0])).join();
            outcome = new DrainOutcome(false, null, dispatched, succeeded.get(), retried.get(), failed.get());
            if (dispatched > 0) {
                logger.info("offline queue drained dispatched={} succeeded={} retried={} failed={}",
                        dispatched, succeeded.get(), retried.get(), failed.get());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.warn("offline queue drain interrupted");
        } catch (RuntimeException ex) {
            logger.error("offline queue drain failed", ex);
        } finally {
            MDC.remove(MDC_TRACE_ID);
            finishDrain(drain, outcome);
        }
    }

    private void finishDrain(CompletableFuture<DrainOutcome> drain, DrainOutcome outcome) {
        final boolean again;
        synchronized (this) {
            activeDrain = null;
            again = redrainRequested && !destroyed && hasEligibleLocked();
            redrainRequested = false;
        }
        publishStatus();
        drain.complete(outcome);
        if (again) {
            processQueue();
        }
    }

    private synchronized List<QueuedOperationRecord> selectEligible() {
        final Instant now = clock.instant();
        return operations.values().stream()
                .filter(record -> !inFlight.contains(record.id()) && record.isEligibleAt(now))
                .sorted(DISPATCH_ORDER)
                .toList();
    }

    private boolean hasEligibleLocked() {
        final Instant now = clock.instant();
        return operations.values().stream()
                .anyMatch(record -> !inFlight.contains(record.id()) && record.isEligibleAt(now));
    }

    private synchronized boolean markInFlight(String id) {
        final QueuedOperationRecord current = operations.get(id);
        if (current == null || destroyed || inFlight.contains(id)) {
            return false;
        }
        inFlight.add(id);
        return true;
    }

    private void processOperation(
            String id, String traceId, AtomicInteger succeeded, AtomicInteger retried, AtomicInteger failed) {
        final QueuedOperationRecord record;
        final OperationCallbacks callback;
        synchronized (this) {
            record = operations.get(id);
            callback = callbacks.get(id);
            if (record == null) {
                inFlight.remove(id);
                return;
            }
        }
        MDC.put(MDC_OPERATION_ID, id);
        if (traceId != null) {
            MDC.put(MDC_TRACE_ID, traceId);
        }
        try {
            notifyProgress(callback, new OperationProgress(id, 0, 1));
            final JsonNode result;
            try {
                result = executors.execute(record);
            } catch (RuntimeException ex) {
                if (handleFailure(record, callback, OperationException.from(ex))) {
                    failed.incrementAndGet();
                } else {
                    retried.incrementAndGet();
                }
                return;
            }
            handleSuccess(record, callback, result);
            succeeded.incrementAndGet();
        } finally {
            MDC.remove(MDC_OPERATION_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private void handleSuccess(QueuedOperationRecord record, OperationCallbacks callback, JsonNode result) {
        if (callback != null) {
            notifyProgress(callback, new OperationProgress(record.id(), 1, 1));
            try {
                callback.onSuccess(result);
            } catch (RuntimeException ex) {
                logger.warn("operation success callback failed id={}", record.id(), ex);
            }
        }
        synchronized (this) {
            inFlight.remove(record.id());
            if (operations.remove(record.id()) != null) {
                callbacks.remove(record.id());
                persistLocked();
            }
        }
        metrics.recordOperationResult(record.type().value(), "succeeded");
        logger.info("operation completed id={} type={} attempts={}",
                record.id(), record.type().value(), record.retryCount() + 1);
        publishStatus();
    }

    /**
     * @return {@code true} when the operation was exhausted and removed
     */
    private boolean handleFailure(QueuedOperationRecord record, OperationCallbacks callback, OperationException ex) {
        final int nextRetryCount = ex.retryable() ? record.retryCount() + 1 : record.maxRetries();
        final boolean exhausted = nextRetryCount >= record.maxRetries();
        Instant nextAttemptAt = null;
        synchronized (this) {
            inFlight.remove(record.id());
            if (!operations.containsKey(record.id())) {
                // 実行中に dequeue/clear された操作は再試行しない
                logger.info("operation failed after removal id={} type={}", record.id(), record.type().value());
                return false;
            }
            if (exhausted) {
                operations.remove(record.id());
                callbacks.remove(record.id());
            } else {
                nextAttemptAt = clock.instant().plus(computeBackoffDuration(nextRetryCount));
                operations.put(record.id(), record.withFailure(nextRetryCount, nextAttemptAt, truncateError(ex.getMessage())));
            }
            persistLocked();
        }

        if (exhausted) {
            logExhausted(record, ex);
            metrics.recordOperationResult(record.type().value(), "failed");
            if (callback != null) {
                try {
                    callback.onError(ex);
                } catch (RuntimeException callbackError) {
                    logger.warn("operation error callback failed id={}", record.id(), callbackError);
                }
            }
        } else {
            metrics.recordOperationResult(record.type().value(), "retried");
            logger.warn("operation retry scheduled id={} type={} attempt={}/{} nextAttemptAt={} code={}",
                    record.id(), record.type().value(), nextRetryCount, record.maxRetries(), nextAttemptAt,
                    ex.code().value());
            scheduleRedrain(nextAttemptAt);
        }
        publishStatus();
        return exhausted;
    }

    private void logExhausted(QueuedOperationRecord record, OperationException ex) {
        if (ex.severity() == ErrorSeverity.HIGH || ex.severity() == ErrorSeverity.CRITICAL) {
            logger.error("operation failed permanently id={} type={} code={} retryable={}",
                    record.id(), record.type().value(), ex.code().value(), ex.retryable(), ex);
        } else {
            logger.warn("operation failed permanently id={} type={} code={} retryable={}",
                    record.id(), record.type().value(), ex.code().value(), ex.retryable(), ex);
        }
    }

    private void scheduleRedrain(Instant at) {
        if (!autoRetry || at == null) {
            return;
        }
        final ScheduledFuture<?> future = taskScheduler.schedule(this::drainAfterBackoff, at);
        synchronized (this) {
            scheduledDrains.removeIf(ScheduledFuture::isDone);
            if (future != null) {
                scheduledDrains.add(future);
            }
        }
    }

    private void drainAfterBackoff() {
        synchronized (this) {
            if (destroyed || operations.isEmpty()) {
                return;
            }
        }
        if (isNetworkOnline()) {
            processQueue();
        }
    }

    private void notifyProgress(OperationCallbacks callback, OperationProgress progress) {
        if (callback == null) {
            return;
        }
        try {
            callback.onProgress(progress);
        } catch (RuntimeException ex) {
            logger.warn("operation progress callback failed id={}", progress.operationId(), ex);
        }
    }

    // 呼び出し側でロックを保持していること
    private void persistLocked() {
        try {
            store.save(new ArrayList<>(operations.values()));
        } catch (OperationQueueStoreException ex) {
            // 永続化に失敗してもメモリ上のキューは使い続ける
            metrics.recordPersistFailure();
            logger.error("failed to persist offline queue size={}", operations.size(), ex);
        }
    }

    // 呼び出し側でロックを保持していること
    private List<QueuedOperationRecord> trimToCapacityLocked() {
        final List<QueuedOperationRecord> removed = new ArrayList<>();
        while (operations.size() > properties.maxQueueSize()) {
            QueuedOperationRecord victim = findEvictionCandidate();
            if (victim == null) {
                victim = operations.values().stream().max(DISPATCH_ORDER).orElseThrow();
            }
            operations.remove(victim.id());
            callbacks.remove(victim.id());
            removed.add(victim);
        }
        return removed;
    }

    private QueuedOperationRecord findEvictionCandidate() {
        return operations.values().stream()
                .filter(record -> record.priority() <= EVICTABLE_PRIORITY && !inFlight.contains(record.id()))
                .min(AGE_ORDER)
                .orElse(null);
    }

    private boolean isNetworkOnline() {
        return networkMonitor == null || networkMonitor.isOnline();
    }

    private void publishStatus() {
        final QueueStatus status = getStatus();
        metrics.updateBacklog(status.totalOperations());
        statusListeners.publish(status);
    }

    private String truncateError(String message) {
        if (message == null) {
            return "unknown error";
        }
        if (message.length() <= ERROR_MESSAGE_MAX_LENGTH) {
            return message;
        }
        return message.substring(0, ERROR_MESSAGE_MAX_LENGTH);
    }
}
