package com.example.cloudsave.storage;

import java.time.Duration;

public record ConnectionCheckResult(boolean connected, String error, Duration latency) {

  public static ConnectionCheckResult connected(Duration latency) {
    return new ConnectionCheckResult(true, null, latency);
  }

  public static ConnectionCheckResult failed(String error, Duration latency) {
    return new ConnectionCheckResult(false, error, latency);
  }
}
