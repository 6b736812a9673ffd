package com.example.cloudsave.integrity;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;

public enum FieldKind {
  STRING,
  NUMBER,
  BOOLEAN,
  OBJECT,
  ARRAY;

  public boolean matches(JsonNode value) {
    return switch (this) {
      case STRING -> value.isTextual();
      case NUMBER -> value.isNumber();
      case BOOLEAN -> value.isBoolean();
      case OBJECT -> value.isObject();
      case ARRAY -> value.isArray();
    };
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  static String describe(JsonNode value) {
    if (value.isNull()) {
      return "null";
    }
    return value.getNodeType().name().toLowerCase(Locale.ROOT);
  }
}
