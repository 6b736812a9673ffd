/*
 * どこで: Cloud Save キュー実行器
 * 何を: クラウドからセーブデータを取得し、チェックサムと構造を検証して返す
 * なぜ: 転送や保存中に壊れたデータをゲームへ渡さないため
 */
package com.example.cloudsave.storage;

import com.example.cloudsave.error.CloudErrorCode;
import com.example.cloudsave.error.ErrorSeverity;
import com.example.cloudsave.error.OperationException;
import com.example.cloudsave.integrity.DataIntegrityResult;
import com.example.cloudsave.integrity.IntegrityValidator;
import com.example.cloudsave.integrity.SaveDataSchema;
import com.example.cloudsave.integrity.ValidationOptions;
import com.example.cloudsave.queue.OperationExecutor;
import com.example.cloudsave.queue.OperationMetadata;
import com.example.cloudsave.queue.OperationType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoadOperationExecutor implements OperationExecutor {

  private static final Logger logger = LoggerFactory.getLogger(LoadOperationExecutor.class);

  private final CloudStorageClient client;
  private final IntegrityValidator validator;
  private final SaveDataSchema schema;
  private final ObjectMapper objectMapper;

  public LoadOperationExecutor(
      CloudStorageClient client,
      IntegrityValidator validator,
      SaveDataSchema schema,
      ObjectMapper objectMapper) {
    this.client = client;
    this.validator = validator;
    this.schema = schema;
    this.objectMapper = objectMapper;
  }

  @Override
  public OperationType type() {
    return OperationType.LOAD;
  }

  @Override
  public JsonNode execute(JsonNode payload, OperationMetadata metadata) {
    final String ownerId = StoragePayloads.requireOwner(metadata);
    final Integer requestedSlot =
        payload == null || payload.isNull()
            ? null
            : StoragePayloads.read(objectMapper, payload, StoragePayloads.SlotRequest.class).slotNumber();
    final int slot = StoragePayloads.resolveSlot(requestedSlot, metadata);

    final CloudSave save =
        client
            .load(ownerId, slot)
            .orElseThrow(
                () ->
                    OperationException.nonRetryable(
                        CloudErrorCode.STORAGE_NOT_FOUND,
                        ErrorSeverity.LOW,
                        "no cloud save for owner " + ownerId + " slot " + slot));

    final DataIntegrityResult integrity =
        validator.validateDataIntegrity(
            save.gameState(), save.checksum(), schema, ValidationOptions.defaults().withRecovery());
    if (integrity.checksumMismatch()) {
      throw OperationException.nonRetryable(
          CloudErrorCode.DATA_CHECKSUM_MISMATCH,
          ErrorSeverity.HIGH,
          "downloaded save failed checksum verification for slot " + slot);
    }
    if (!integrity.isValid()) {
      logger.warn(
          "downloaded save has structural problems ownerId={} slot={} errors={}",
          ownerId,
          slot,
          integrity.errors().size());
    }
    return objectMapper.valueToTree(
        new LoadResult(
            slot,
            save.saveName(),
            save.gameState(),
            save.checksum(),
            save.updatedAt(),
            integrity.isValid(),
            integrity.errors(),
            integrity.warnings(),
            integrity.recoveredData()));
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record LoadResult(
      int slotNumber,
      String saveName,
      JsonNode gameState,
      String checksum,
      Instant updatedAt,
      boolean valid,
      List<String> errors,
      List<String> warnings,
      JsonNode recoveredData) {}
}
