package com.example.cloudsave.queue;

import com.example.cloudsave.error.OperationException;
import com.fasterxml.jackson.databind.JsonNode;

/** Performs one operation type. Anything thrown is normalized by the queue. */
public interface OperationExecutor {

  OperationType type();

  JsonNode execute(JsonNode payload, OperationMetadata metadata) throws OperationException;
}
