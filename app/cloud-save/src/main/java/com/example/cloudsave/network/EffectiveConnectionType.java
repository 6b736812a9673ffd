package com.example.cloudsave.network;

import com.fasterxml.jackson.annotation.JsonValue;

/** Effective bandwidth class reported by the host, in the usual slow-2g .. 4g buckets. */
public enum EffectiveConnectionType {
  SLOW_2G("slow-2g"),
  TYPE_2G("2g"),
  TYPE_3G("3g"),
  TYPE_4G("4g"),
  UNKNOWN("unknown");

  private final String value;

  EffectiveConnectionType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
