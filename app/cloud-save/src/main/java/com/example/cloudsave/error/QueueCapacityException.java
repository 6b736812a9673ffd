package com.example.cloudsave.error;

/** Thrown by enqueue when the queue is full and no low-priority operation can be evicted. */
public class QueueCapacityException extends RuntimeException {

  private final int maxQueueSize;

  public QueueCapacityException(int maxQueueSize) {
    super("offline queue is full (max " + maxQueueSize + ")");
    this.maxQueueSize = maxQueueSize;
  }

  public int maxQueueSize() {
    return maxQueueSize;
  }
}
