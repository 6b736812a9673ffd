package com.example.cloudsave.queue;

public record DrainOutcome(
    boolean skipped, String skipReason, int dispatched, int succeeded, int retried, int failed) {

  static final String SKIPPED_OFFLINE = "offline";
  static final String SKIPPED_DESTROYED = "destroyed";

  static DrainOutcome skipped(String reason) {
    return new DrainOutcome(true, reason, 0, 0, 0, 0);
  }
}
