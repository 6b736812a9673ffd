package com.example.cloudsave.integrity;

import java.util.List;

public record StructureValidationResult(
    List<String> errors, List<String> warnings, List<String> corruptedFields) {

  public StructureValidationResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
    corruptedFields = List.copyOf(corruptedFields);
  }

  public boolean isValid(boolean strictMode) {
    return errors.isEmpty() && (!strictMode || warnings.isEmpty());
  }
}
