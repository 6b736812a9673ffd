package com.example.cloudsave.queue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum OperationType {
  SAVE,
  LOAD,
  DELETE,
  SYNC,
  CUSTOM;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static OperationType fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
