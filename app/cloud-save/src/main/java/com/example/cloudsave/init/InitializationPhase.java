package com.example.cloudsave.init;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum InitializationPhase {
  IDLE,
  LOADING_CONFIG,
  VALIDATING_CONFIG,
  INITIALIZING_SERVICES,
  TESTING_CONNECTIONS,
  FINALIZING,
  READY,
  FAILED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
