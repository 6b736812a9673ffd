package com.example.cloudsave.queue;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OperationMetadata(
    String ownerId, Integer slotNumber, String saveName, String description) {

  public static OperationMetadata forOwner(String ownerId) {
    return new OperationMetadata(ownerId, null, null, null);
  }

  public static OperationMetadata forSlot(String ownerId, int slotNumber) {
    return new OperationMetadata(ownerId, slotNumber, null, null);
  }
}
