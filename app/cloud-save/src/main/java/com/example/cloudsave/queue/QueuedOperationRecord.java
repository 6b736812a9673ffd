/*
 * どこで: Cloud Save オフラインキュー
 * 何を: 永続化されるキュー操作 1 件を表す (コールバックは含まない)
 * なぜ: プロセス再起動後も再実行できる情報だけをスナップショットへ書き出すため
 */
package com.example.cloudsave.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.NullNode;
import java.time.Instant;

/**
 * @param nextAttemptAt earliest instant the operation may be dispatched again, {@code null} when
 *     it has never failed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueuedOperationRecord(
    String id,
    OperationType type,
    Instant createdAt,
    int retryCount,
    int maxRetries,
    int priority,
    JsonNode payload,
    OperationMetadata metadata,
    Instant nextAttemptAt,
    String lastError) {

  public QueuedOperationRecord {
    payload = payload == null ? NullNode.getInstance() : payload;
  }

  @JsonIgnore
  public boolean isExhausted() {
    return retryCount >= maxRetries;
  }

  /** Not exhausted and past its backoff gate. In-flight state is tracked by the queue. */
  @JsonIgnore
  public boolean isEligibleAt(Instant now) {
    return !isExhausted() && (nextAttemptAt == null || !nextAttemptAt.isAfter(now));
  }

  @JsonIgnore
  public String ownerId() {
    return metadata == null ? null : metadata.ownerId();
  }

  QueuedOperationRecord withFailure(int nextRetryCount, Instant nextAttempt, String error) {
    return new QueuedOperationRecord(
        id, type, createdAt, nextRetryCount, maxRetries, priority, payload, metadata, nextAttempt, error);
  }

  QueuedOperationRecord withRetriesReset() {
    return new QueuedOperationRecord(
        id, type, createdAt, 0, maxRetries, priority, payload, metadata, null, lastError);
  }
}
