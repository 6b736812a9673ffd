package com.example.cloudsave.integrity;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

public record RecoveryResult(
    boolean recovered, JsonNode data, List<String> restoredFields, List<String> warnings) {

  public RecoveryResult {
    restoredFields = List.copyOf(restoredFields);
    warnings = List.copyOf(warnings);
  }
}
