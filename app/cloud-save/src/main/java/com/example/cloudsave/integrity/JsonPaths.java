package com.example.cloudsave.integrity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/** Dot-separated object paths such as {@code player.stats.health}. Array indices are not supported. */
final class JsonPaths {

  private JsonPaths() {}

  /** Empty when any segment is absent. An explicit JSON {@code null} counts as present. */
  static Optional<JsonNode> find(JsonNode root, String path) {
    JsonNode current = root;
    for (String segment : path.split("\\.")) {
      if (current == null || !current.isObject() || !current.has(segment)) {
        return Optional.empty();
      }
      current = current.get(segment);
    }
    return Optional.ofNullable(current);
  }

  /** Sets the value, replacing missing or non-object intermediate nodes with empty objects. */
  static void set(ObjectNode root, String path, JsonNode value) {
    final String[] segments = path.split("\\.");
    ObjectNode current = root;
    for (int i = 0; i < segments.length - 1; i++) {
      final JsonNode next = current.get(segments[i]);
      if (next instanceof ObjectNode nextObject) {
        current = nextObject;
      } else {
        current = current.putObject(segments[i]);
      }
    }
    current.set(segments[segments.length - 1], value);
  }
}
