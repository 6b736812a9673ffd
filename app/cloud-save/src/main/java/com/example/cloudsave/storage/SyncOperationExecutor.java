/*
 * どこで: Cloud Save キュー実行器
 * 何を: ローカルのセーブ一覧とクラウド上の一覧を比較し、新しい側を残す (後勝ち)
 * なぜ: オフライン中に進んだローカルセーブをまとめてクラウドへ反映するため
 */
package com.example.cloudsave.storage;

import com.example.cloudsave.integrity.IntegrityValidator;
import com.example.cloudsave.integrity.SaveDataSchema;
import com.example.cloudsave.integrity.StructureValidationResult;
import com.example.cloudsave.integrity.ValidationOptions;
import com.example.cloudsave.queue.OperationExecutor;
import com.example.cloudsave.queue.OperationMetadata;
import com.example.cloudsave.queue.OperationType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SyncOperationExecutor implements OperationExecutor {

  private static final Logger logger = LoggerFactory.getLogger(SyncOperationExecutor.class);

  private final CloudStorageClient client;
  private final IntegrityValidator validator;
  private final SaveDataSchema schema;
  private final long maxSaveSize;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public SyncOperationExecutor(
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
    return OperationType.SYNC;
  }

  @Override
  public JsonNode execute(JsonNode payload, OperationMetadata metadata) {
    final String ownerId = StoragePayloads.requireOwner(metadata);
    final StoragePayloads.SyncRequest request =
        StoragePayloads.read(objectMapper, payload, StoragePayloads.SyncRequest.class);
    final List<StoragePayloads.LocalSave> locals = request.saves() == null ? List.of() : request.saves();

    final Map<Integer, CloudSaveSummary> remote = new HashMap<>();
    for (CloudSaveSummary summary : client.list(ownerId)) {
      remote.put(summary.slotNumber(), summary);
    }

    final List<Integer> uploaded = new ArrayList<>();
    final List<Integer> remoteNewer = new ArrayList<>();
    final List<Integer> unchanged = new ArrayList<>();
    final List<Integer> rejected = new ArrayList<>();
    for (StoragePayloads.LocalSave local : locals) {
      final int slot = StoragePayloads.resolveSlot(local.slotNumber(), null);
      if (local.gameState() == null || !local.gameState().isObject()) {
        rejected.add(slot);
        continue;
      }
      final ObjectNode sanitized = sanitize(local.gameState());
      final String checksum = validator.generateChecksum(sanitized);
      final CloudSaveSummary existing = remote.get(slot);
      if (existing != null && checksum.equals(existing.checksum())) {
        unchanged.add(slot);
        continue;
      }
      if (existing != null && !isNewer(local.updatedAt(), existing.updatedAt())) {
        remoteNewer.add(slot);
        continue;
      }
      final StructureValidationResult structure =
          validator.validateStructure(
              sanitized,
              schema,
              ValidationOptions.defaults().withDeepValidation().withMaxDataSize(maxSaveSize));
      if (!structure.isValid(false)) {
        logger.warn(
            "sync skipped invalid local save ownerId={} slot={} errors={}",
            ownerId,
            slot,
            structure.errors().size());
        rejected.add(slot);
        continue;
      }
      final Instant updatedAt = local.updatedAt() == null ? clock.instant() : local.updatedAt();
      client.save(
          new CloudSave(
              ownerId,
              slot,
              SaveOperationExecutor.resolveSaveName(local.saveName(), null, slot),
              sanitized,
              checksum,
              updatedAt));
      uploaded.add(slot);
    }
    logger.info(
        "sync finished ownerId={} uploaded={} remoteNewer={} unchanged={} rejected={}",
        ownerId,
        uploaded.size(),
        remoteNewer.size(),
        unchanged.size(),
        rejected.size());
    return objectMapper.valueToTree(new SyncReport(uploaded, remoteNewer, unchanged, rejected));
  }

  // 同期ではセーブ自身の timestamp を残す (実行時刻で毎回チェックサムが変わらないように)
  private ObjectNode sanitize(JsonNode gameState) {
    final ObjectNode sanitized = validator.sanitizeForCloud(gameState);
    final JsonNode timestamp = gameState.get("timestamp");
    if (timestamp != null && timestamp.isTextual()) {
      sanitized.set("timestamp", timestamp.deepCopy());
    }
    return sanitized;
  }

  // 更新時刻が不明なローカルセーブはクラウド側を優先する
  private static boolean isNewer(Instant local, Instant remote) {
    if (local == null) {
      return false;
    }
    return remote == null || local.isAfter(remote);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record SyncReport(
      List<Integer> uploaded, List<Integer> remoteNewer, List<Integer> unchanged, List<Integer> rejected) {}
}
