package com.example.cloudsave.queue;

import com.example.cloudsave.error.OperationException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.function.Consumer;

/**
 * In-memory completion hooks for one operation. Never persisted, so operations reloaded after a
 * restart run without them.
 */
public interface OperationCallbacks {

  default void onSuccess(JsonNode result) {}

  default void onError(OperationException error) {}

  default void onProgress(OperationProgress progress) {}

  static OperationCallbacks of(
      Consumer<JsonNode> onSuccess, Consumer<OperationException> onError) {
    return new OperationCallbacks() {
      @Override
      public void onSuccess(JsonNode result) {
        if (onSuccess != null) {
          onSuccess.accept(result);
        }
      }

      @Override
      public void onError(OperationException error) {
        if (onError != null) {
          onError.accept(error);
        }
      }
    };
  }
}
