package com.example.cloudsave.queue;

/** Per-operation overrides. {@code null} fields fall back to the queue defaults. */
public record EnqueueOptions(
    Integer priority, Integer maxRetries, OperationMetadata metadata, OperationCallbacks callbacks) {

  public static EnqueueOptions defaults() {
    return new EnqueueOptions(null, null, null, null);
  }

  public EnqueueOptions withPriority(int value) {
    return new EnqueueOptions(value, maxRetries, metadata, callbacks);
  }

  public EnqueueOptions withMaxRetries(int value) {
    return new EnqueueOptions(priority, value, metadata, callbacks);
  }

  public EnqueueOptions withMetadata(OperationMetadata value) {
    return new EnqueueOptions(priority, maxRetries, value, callbacks);
  }

  public EnqueueOptions withCallbacks(OperationCallbacks value) {
    return new EnqueueOptions(priority, maxRetries, metadata, value);
  }
}
