package com.example.cloudsave.storage;

import com.example.cloudsave.error.CloudErrorCode;
import com.example.cloudsave.error.ErrorSeverity;
import com.example.cloudsave.error.OperationException;
import com.example.cloudsave.queue.OperationExecutor;
import com.example.cloudsave.queue.OperationMetadata;
import com.example.cloudsave.queue.OperationType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/** Dispatches {@code {"handler": name, "args": ...}} payloads to the named handler. */
public class CustomOperationExecutor implements OperationExecutor {

  private final Map<String, CustomOperationHandler> handlers = new HashMap<>();

  public CustomOperationExecutor(Collection<? extends CustomOperationHandler> handlers) {
    for (CustomOperationHandler handler : handlers) {
      if (this.handlers.putIfAbsent(handler.name(), handler) != null) {
        throw new IllegalArgumentException("duplicate custom operation handler " + handler.name());
      }
    }
  }

  @Override
  public OperationType type() {
    return OperationType.CUSTOM;
  }

  @Override
  public JsonNode execute(JsonNode payload, OperationMetadata metadata) {
    final String name = payload == null ? null : payload.path("handler").asText(null);
    if (name == null || name.isBlank()) {
      throw StoragePayloads.invalid("custom operation payload requires a handler name");
    }
    final CustomOperationHandler handler = handlers.get(name);
    if (handler == null) {
      throw OperationException.nonRetryable(
          CloudErrorCode.OPERATION_FAILED,
          ErrorSeverity.MEDIUM,
          "no custom operation handler named " + name);
    }
    final JsonNode args = payload.has("args") ? payload.get("args") : NullNode.getInstance();
    final JsonNode result = handler.handle(args, metadata);
    return result == null ? NullNode.getInstance() : result;
  }
}
