package com.example.cloudsave.network;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ConnectionQuality {
  EXCELLENT,
  GOOD,
  FAIR,
  POOR,
  UNKNOWN;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isSuitableForCloudOperations() {
    return this == EXCELLENT || this == GOOD || this == FAIR;
  }
}
