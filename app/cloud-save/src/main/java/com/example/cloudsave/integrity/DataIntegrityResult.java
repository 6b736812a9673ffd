package com.example.cloudsave.integrity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Outcome of {@link IntegrityValidator#validateDataIntegrity}. {@code recoveredData} is only set
 * when recovery was requested and restored at least one field; it never flips {@code isValid}.
 * {@code schema} is the schema the data was checked against.
 */
public record DataIntegrityResult(
    boolean isValid,
    String checksum,
    List<String> errors,
    List<String> warnings,
    List<String> corruptedFields,
    JsonNode recoveredData,
    @JsonIgnore SaveDataSchema schema) {

  public DataIntegrityResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
    corruptedFields = List.copyOf(corruptedFields);
    recoveredData = recoveredData == null ? null : recoveredData.deepCopy();
    schema = schema == null ? SaveDataSchema.gameStateDefault() : schema;
  }

  public boolean checksumMismatch() {
    return corruptedFields.contains(IntegrityValidator.CHECKSUM_FIELD);
  }
}
