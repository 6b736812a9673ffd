/*
 * どこで: Cloud Save キュー実行器
 * 何を: セーブデータを整形・検証し、チェックサムを付けてクラウドへ保存する
 * なぜ: 破損や上限超過のデータをアップロード前に止めるため
 */
package com.example.cloudsave.storage;

import com.example.cloudsave.error.CloudErrorCode;
import com.example.cloudsave.error.ErrorSeverity;
import com.example.cloudsave.error.OperationException;
import com.example.cloudsave.integrity.IntegrityValidator;
import com.example.cloudsave.integrity.SaveDataSchema;
import com.example.cloudsave.integrity.StructureValidationResult;
import com.example.cloudsave.integrity.ValidationOptions;
import com.example.cloudsave.queue.OperationExecutor;
import com.example.cloudsave.queue.OperationMetadata;
import com.example.cloudsave.queue.OperationType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;

public class SaveOperationExecutor implements OperationExecutor {

  private final CloudStorageClient client;
  private final IntegrityValidator validator;
  private final SaveDataSchema schema;
  private final long maxSaveSize;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public SaveOperationExecutor(
      CloudStorageClient client,
      IntegrityValidator validator,
      SaveDataSchema schema,
      long maxSaveSize,
      ObjectMapper objectMapper,
      Clock clock) {
    this.client = client;
    this.validator = validator;
    this.schema = schema;
    this.maxSaveSize = maxSaveSize;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public OperationType type() {
    return OperationType.SAVE;
  }

  @Override
  public JsonNode execute(JsonNode payload, OperationMetadata metadata) {
    final StoragePayloads.SaveRequest request =
        StoragePayloads.read(objectMapper, payload, StoragePayloads.SaveRequest.class);
    final String ownerId = StoragePayloads.requireOwner(metadata);
    final int slot = StoragePayloads.resolveSlot(request.slotNumber(), metadata);
    if (request.gameState() == null || !request.gameState().isObject()) {
      throw StoragePayloads.invalid("game_state must be a JSON object");
    }

    final ObjectNode sanitized = validator.sanitizeForCloud(request.gameState());
    final StructureValidationResult structure =
        validator.validateStructure(
            sanitized,
            schema,
            ValidationOptions.defaults().withDeepValidation().withMaxDataSize(maxSaveSize));
    if (!structure.isValid(false)) {
      throw OperationException.nonRetryable(
          CloudErrorCode.DATA_INVALID,
          ErrorSeverity.MEDIUM,
          "save data failed validation: " + String.join("; ", structure.errors()));
    }

    final String saveName = resolveSaveName(request.saveName(), metadata, slot);
    final CloudSave save =
        new CloudSave(
            ownerId, slot, saveName, sanitized, validator.generateChecksum(sanitized), clock.instant());
    return objectMapper.valueToTree(client.save(save));
  }

  static String resolveSaveName(String requested, OperationMetadata metadata, int slot) {
    if (requested != null && !requested.isBlank()) {
      return requested;
    }
    if (metadata != null && metadata.saveName() != null && !metadata.saveName().isBlank()) {
      return metadata.saveName();
    }
    return "Slot " + slot;
  }
}
