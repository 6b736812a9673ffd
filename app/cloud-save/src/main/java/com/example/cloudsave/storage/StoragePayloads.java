package com.example.cloudsave.storage;

import com.example.cloudsave.error.CloudErrorCode;
import com.example.cloudsave.error.ErrorSeverity;
import com.example.cloudsave.error.OperationException;
import com.example.cloudsave.queue.OperationMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

/** Payload shapes accepted by the built-in storage executors, and their parsing helpers. */
final class StoragePayloads {

  private StoragePayloads() {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record SaveRequest(Integer slotNumber, String saveName, JsonNode gameState) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record SlotRequest(Integer slotNumber) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record SyncRequest(List<LocalSave> saves) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record LocalSave(Integer slotNumber, String saveName, JsonNode gameState, Instant updatedAt) {}

  static <T> T read(ObjectMapper objectMapper, JsonNode payload, Class<T> type) {
    if (payload == null || payload.isNull() || payload.isMissingNode()) {
      throw invalid("operation payload is required");
    }
    try {
      return objectMapper.treeToValue(payload, type);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw OperationException.nonRetryable(
          CloudErrorCode.DATA_INVALID,
          ErrorSeverity.MEDIUM,
          "operation payload is malformed: "
              + (ex instanceof JsonProcessingException parse ? parse.getOriginalMessage() : ex.getMessage()),
          ex);
    }
  }

  static String requireOwner(OperationMetadata metadata) {
    if (metadata == null || metadata.ownerId() == null || metadata.ownerId().isBlank()) {
      throw invalid("metadata.owner_id is required");
    }
    return metadata.ownerId();
  }

  static int resolveSlot(Integer payloadSlot, OperationMetadata metadata) {
    final Integer slot = payloadSlot != null ? payloadSlot : metadata == null ? null : metadata.slotNumber();
    if (slot == null || slot < 0) {
      throw invalid("a non-negative slot_number is required");
    }
    return slot;
  }

  static OperationException invalid(String message) {
    return OperationException.nonRetryable(CloudErrorCode.DATA_INVALID, ErrorSeverity.MEDIUM, message);
  }
}
