package com.example.cloudsave.api.response;

import com.example.cloudsave.queue.QueueStatus;
import com.example.cloudsave.queue.QueuedOperationRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueSnapshotResponse(QueueStatus status, List<QueuedOperationRecord> operations) {}
