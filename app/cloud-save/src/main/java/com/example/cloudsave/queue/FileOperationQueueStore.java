/*
 * どこで: Cloud Save オフラインキュー永続化
 * 何を: キューのスナップショットを JSON ファイルへ原子的に置き換え保存する
 * なぜ: 書き込み途中でプロセスが落ちても前回のスナップショットを壊さないため
 */
package com.example.cloudsave.queue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FileOperationQueueStore implements OperationQueueStore {

  private static final Logger logger = LoggerFactory.getLogger(FileOperationQueueStore.class);
  private static final TypeReference<List<QueuedOperationRecord>> SNAPSHOT_TYPE =
      new TypeReference<>() {};

  private final Path path;
  private final ObjectMapper objectMapper;

  public FileOperationQueueStore(Path path, ObjectMapper objectMapper) {
    this.path = path.toAbsolutePath();
    // 時刻は ISO-8601 文字列で書き出し、旧バージョンの余剰フィールドは無視する
    this.objectMapper =
        objectMapper
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  @Override
  public List<QueuedOperationRecord> load() {
    if (!Files.exists(path)) {
      return List.of();
    }
    try {
      final List<QueuedOperationRecord> records = objectMapper.readValue(path.toFile(), SNAPSHOT_TYPE);
      return records == null ? List.of() : List.copyOf(records);
    } catch (IOException ex) {
      // 壊れたスナップショットで起動不能にならないよう空のキューから始める
      logger.error("failed to read offline queue snapshot path={}", path, ex);
      return List.of();
    }
  }

  @Override
  public void save(List<QueuedOperationRecord> snapshot) {
    try {
      final Path parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      final Path temp = path.resolveSibling(path.getFileName() + ".tmp");
      objectMapper.writeValue(temp.toFile(), snapshot);
      try {
        Files.move(
            temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException ex) {
      throw new OperationQueueStoreException("failed to write offline queue snapshot " + path, ex);
    }
  }

  @Override
  public void delete() {
    try {
      Files.deleteIfExists(path);
    } catch (IOException ex) {
      throw new OperationQueueStoreException("failed to delete offline queue snapshot " + path, ex);
    }
  }

  public Path path() {
    return path;
  }
}
