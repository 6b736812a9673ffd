package com.example.cloudsave.queue;

import com.example.cloudsave.error.CloudErrorCode;
import com.example.cloudsave.error.ErrorSeverity;
import com.example.cloudsave.error.OperationException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

public class OperationExecutorRegistry {

  private final Map<OperationType, OperationExecutor> executors = new EnumMap<>(OperationType.class);

  public OperationExecutorRegistry(Collection<? extends OperationExecutor> executors) {
    for (OperationExecutor executor : executors) {
      final OperationExecutor previous = this.executors.putIfAbsent(executor.type(), executor);
      if (previous != null) {
        throw new IllegalArgumentException("duplicate executor for type " + executor.type().value());
      }
    }
  }

  public Set<OperationType> supportedTypes() {
    return executors.keySet();
  }

  JsonNode execute(QueuedOperationRecord record) {
    final OperationExecutor executor = executors.get(record.type());
    if (executor == null) {
      throw OperationException.nonRetryable(
          CloudErrorCode.OPERATION_FAILED,
          ErrorSeverity.HIGH,
          "no executor registered for operation type " + record.type().value());
    }
    return executor.execute(record.payload(), record.metadata());
  }
}
