package com.example.cloudsave.storage;

import com.example.cloudsave.queue.OperationExecutor;
import com.example.cloudsave.queue.OperationMetadata;
import com.example.cloudsave.queue.OperationType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class DeleteOperationExecutor implements OperationExecutor {

  private final CloudStorageClient client;
  private final ObjectMapper objectMapper;

  public DeleteOperationExecutor(CloudStorageClient client, ObjectMapper objectMapper) {
    this.client = client;
    this.objectMapper = objectMapper;
  }

  @Override
  public OperationType type() {
    return OperationType.DELETE;
  }

  @Override
  public JsonNode execute(JsonNode payload, OperationMetadata metadata) {
    final String ownerId = StoragePayloads.requireOwner(metadata);
    final Integer requestedSlot =
        payload == null || payload.isNull()
            ? null
            : StoragePayloads.read(objectMapper, payload, StoragePayloads.SlotRequest.class).slotNumber();
    final int slot = StoragePayloads.resolveSlot(requestedSlot, metadata);
    final boolean deleted = client.delete(ownerId, slot);
    final ObjectNode result = JsonNodeFactory.instance.objectNode();
    result.put("slot_number", slot);
    result.put("deleted", deleted);
    return result;
  }
}
