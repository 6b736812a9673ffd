package com.example.cloudsave.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.zip.Deflater;

public enum CompressionLevel {
  FAST(Deflater.BEST_SPEED),
  BALANCED(Deflater.DEFAULT_COMPRESSION),
  MAXIMUM(Deflater.BEST_COMPRESSION);

  private final int deflaterLevel;

  CompressionLevel(int deflaterLevel) {
    this.deflaterLevel = deflaterLevel;
  }

  public int deflaterLevel() {
    return deflaterLevel;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static CompressionLevel fromValue(String value) {
    return value == null ? BALANCED : valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
