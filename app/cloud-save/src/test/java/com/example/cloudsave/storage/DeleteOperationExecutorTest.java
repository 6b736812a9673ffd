package com.example.cloudsave.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.cloudsave.queue.OperationMetadata;
import com.example.cloudsave.support.GameStateFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class DeleteOperationExecutorTest {

  private final ObjectMapper objectMapper = GameStateFixtures.objectMapper();
  private final CloudStorageClient client = mock(CloudStorageClient.class);
  private final DeleteOperationExecutor executor = new DeleteOperationExecutor(client, objectMapper);

  @Test
  void payloadSlotWinsOverMetadata() {
    when(client.delete("user-1", 5)).thenReturn(true);

    final JsonNode result =
        executor.execute(
            objectMapper.createObjectNode().put("slot_number", 5), OperationMetadata.forSlot("user-1", 1));

    assertThat(result.get("slot_number").intValue()).isEqualTo(5);
    assertThat(result.get("deleted").booleanValue()).isTrue();
  }

  @Test
  void missingSaveReportsNotDeleted() {
    when(client.delete("user-1", 1)).thenReturn(false);

    final JsonNode result = executor.execute(null, OperationMetadata.forSlot("user-1", 1));

    assertThat(result.get("deleted").booleanValue()).isFalse();
  }
}
