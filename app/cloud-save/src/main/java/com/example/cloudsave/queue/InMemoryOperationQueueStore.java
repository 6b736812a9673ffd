package com.example.cloudsave.queue;

import java.util.List;

/** Used when queue persistence is disabled. Contents do not survive a restart. */
public class InMemoryOperationQueueStore implements OperationQueueStore {

  private volatile List<QueuedOperationRecord> snapshot = List.of();

  @Override
  public List<QueuedOperationRecord> load() {
    return snapshot;
  }

  @Override
  public void save(List<QueuedOperationRecord> snapshot) {
    this.snapshot = List.copyOf(snapshot);
  }

  @Override
  public void delete() {
    snapshot = List.of();
  }
}
