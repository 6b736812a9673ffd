/*
 * どこで: Cloud Save ストレージ連携
 * 何を: Supabase (PostgREST) の cloud_saves テーブルへセーブデータを upsert/取得/削除する
 * なぜ: Supabase を保存先に選んだ環境で SDK なしにクラウドセーブを扱うため
 */
package com.example.cloudsave.storage;

import com.example.cloudsave.config.CloudSaveProperties;
import com.example.cloudsave.config.ProviderType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class SupabaseStorageClient implements CloudStorageClient {

  private static final String PROVIDER = "supabase";
  private static final String UPSERT_PATH = "/rest/v1/{table}?on_conflict=owner_id,slot_number";
  private static final String SLOT_PATH =
      "/rest/v1/{table}?owner_id=eq.{ownerId}&slot_number=eq.{slot}";
  private static final String LIST_PATH =
      "/rest/v1/{table}?owner_id=eq.{ownerId}&select=slot_number,save_name,checksum,updated_at";
  private static final String PING_PATH = "/rest/v1/{table}?select=slot_number&limit=1";

  private final RestClient restClient;
  private final CloudSaveProperties.Supabase properties;
  private final SavePayloadCodec codec;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public SupabaseStorageClient(
      RestClient restClient,
      CloudSaveProperties.Supabase properties,
      ObjectMapper objectMapper,
      @Nullable SaveDataCompressor compressor) {
    this.restClient = restClient;
    this.properties = properties;
    this.codec = new SavePayloadCodec(objectMapper, compressor);
  }

  @Override
  public ProviderType provider() {
    return ProviderType.SUPABASE;
  }

  @Override
  public SaveReceipt save(CloudSave save) {
    final CompressedPayload payload = codec.encode(save.gameState());
    final SupabaseSaveRow row =
        new SupabaseSaveRow(
            save.ownerId(),
            save.slotNumber(),
            save.saveName(),
            payload.data(),
            payload.compressed(),
            save.checksum(),
            save.updatedAt().toString());
    try {
      restClient
          .post()
          .uri(UPSERT_PATH, properties.table())
          .headers(this::authenticate)
          .header("Prefer", "resolution=merge-duplicates,return=minimal")
          .contentType(MediaType.APPLICATION_JSON)
          .body(List.of(row))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw StorageErrors.fromResponse(PROVIDER, "save", ex);
    } catch (ResourceAccessException ex) {
      throw StorageErrors.fromResourceAccess(PROVIDER, "save", ex);
    }
    return new SaveReceipt(
        PROVIDER,
        save.ownerId(),
        save.slotNumber(),
        save.checksum(),
        payload.compressed(),
        payload.storedSize(),
        save.updatedAt());
  }

  @Override
  public Optional<CloudSave> load(String ownerId, int slotNumber) {
    final SupabaseSaveRow[] rows;
    try {
      rows =
          restClient
              .get()
              .uri(SLOT_PATH, properties.table(), ownerId, slotNumber)
              .headers(this::authenticate)
              .retrieve()
              .body(SupabaseSaveRow[].class);
    } catch (RestClientResponseException ex) {
      throw StorageErrors.fromResponse(PROVIDER, "load", ex);
    } catch (ResourceAccessException ex) {
      throw StorageErrors.fromResourceAccess(PROVIDER, "load", ex);
    }
    if (rows == null || rows.length == 0) {
      return Optional.empty();
    }
    final SupabaseSaveRow row = rows[0];
    if (row.payload() == null) {
      throw StorageErrors.invalidResponse(
          PROVIDER, "load", new IllegalStateException("payload column is missing"));
    }
    try {
      return Optional.of(
          new CloudSave(
              ownerId,
              row.slotNumber() == null ? slotNumber : row.slotNumber(),
              row.saveName(),
              codec.decode(row.payload(), Boolean.TRUE.equals(row.compressed())),
              row.checksum(),
              parseInstant(row.updatedAt())));
    } catch (JsonProcessingException ex) {
      throw StorageErrors.invalidResponse(PROVIDER, "load", ex);
    }
  }

  @Override
  public boolean delete(String ownerId, int slotNumber) {
    final SupabaseSaveRow[] deleted;
    try {
      deleted =
          restClient
              .delete()
              .uri(SLOT_PATH, properties.table(), ownerId, slotNumber)
              .headers(this::authenticate)
              .header("Prefer", "return=representation")
              .retrieve()
              .body(SupabaseSaveRow[].class);
    } catch (RestClientResponseException ex) {
      throw StorageErrors.fromResponse(PROVIDER, "delete", ex);
    } catch (ResourceAccessException ex) {
      throw StorageErrors.fromResourceAccess(PROVIDER, "delete", ex);
    }
    return deleted != null && deleted.length > 0;
  }

  @Override
  public List<CloudSaveSummary> list(String ownerId) {
    final SupabaseSaveRow[] rows;
    try {
      rows =
          restClient
              .get()
              .uri(LIST_PATH, properties.table(), ownerId)
              .headers(this::authenticate)
              .retrieve()
              .body(SupabaseSaveRow[].class);
    } catch (RestClientResponseException ex) {
      throw StorageErrors.fromResponse(PROVIDER, "list", ex);
    } catch (ResourceAccessException ex) {
      throw StorageErrors.fromResourceAccess(PROVIDER, "list", ex);
    }
    final List<CloudSaveSummary> summaries = new ArrayList<>();
    if (rows == null) {
      return summaries;
    }
    for (SupabaseSaveRow row : rows) {
      summaries.add(
          new CloudSaveSummary(
              row.slotNumber() == null ? 0 : row.slotNumber(),
              row.saveName(),
              row.checksum(),
              parseInstant(row.updatedAt())));
    }
    return summaries;
  }

  @Override
  public ConnectionCheckResult checkConnection() {
    final long startedAt = System.nanoTime();
    try {
      restClient
          .get()
          .uri(PING_PATH, properties.table())
          .headers(this::authenticate)
          .retrieve()
          .toBodilessEntity();
      return ConnectionCheckResult.connected(elapsedSince(startedAt));
    } catch (RestClientResponseException ex) {
      return ConnectionCheckResult.failed(
          "supabase responded with status " + ex.getStatusCode().value(), elapsedSince(startedAt));
    } catch (RuntimeException ex) {
      return ConnectionCheckResult.failed(ex.getMessage(), elapsedSince(startedAt));
    }
  }

  private void authenticate(HttpHeaders headers) {
    // service role キーがあれば RLS を越えて操作できるためそちらを優先する
    final String key =
        properties.serviceRoleKey() == null || properties.serviceRoleKey().isBlank()
            ? properties.anonKey()
            : properties.serviceRoleKey();
    headers.set("apikey", properties.anonKey());
    headers.setBearerAuth(key);
  }

  private static Instant parseInstant(String value) {
    if (value == null) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ex) {
      // PostgREST は timestamptz を +00:00 形式で返す
      try {
        return OffsetDateTime.parse(value).toInstant();
      } catch (DateTimeParseException nested) {
        return null;
      }
    }
  }

  private static Duration elapsedSince(long startedAt) {
    return Duration.ofNanos(System.nanoTime() - startedAt);
  }
}
