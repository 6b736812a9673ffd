package com.example.cloudsave.queue;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** {@code completedOperations} is always 0: completed operations leave the queue. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueStatus(
    int totalOperations,
    int pendingOperations,
    int processingOperations,
    int failedOperations,
    int completedOperations,
    @JsonProperty("is_processing") boolean isProcessing,
    Instant nextAttemptAt) {}
