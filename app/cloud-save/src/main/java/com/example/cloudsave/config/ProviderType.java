package com.example.cloudsave.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ProviderType {
  FIREBASE("firebase"),
  SUPABASE("supabase"),
  NONE("none");

  private final String value;

  ProviderType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ProviderType fromValue(String value) {
    if (value == null || value.isBlank()) {
      return NONE;
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ProviderType type : values()) {
      if (type.value.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown provider type: " + value);
  }
}
