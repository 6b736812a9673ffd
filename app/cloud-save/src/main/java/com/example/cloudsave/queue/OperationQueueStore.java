package com.example.cloudsave.queue;

import java.util.List;

/** Snapshot persistence for queued operations. Each save replaces the whole snapshot. */
public interface OperationQueueStore {

  List<QueuedOperationRecord> load();

  void save(List<QueuedOperationRecord> snapshot);

  void delete();
}
