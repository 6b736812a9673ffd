package com.example.cloudsave.network;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ConnectionType {
  ETHERNET,
  WIFI,
  CELLULAR,
  NONE,
  UNKNOWN;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
