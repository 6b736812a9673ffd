/*
 * どこで: Cloud Save ストレージ連携
 * 何を: Firestore REST API の users/{owner}/saves/slot_{n} ドキュメントへセーブデータを読み書きする
 * なぜ: Firebase プロジェクトを保存先に選んだ環境で SDK なしにクラウドセーブを扱うため
 */
package com.example.cloudsave.storage;

import com.example.cloudsave.config.CloudSaveProperties;
import com.example.cloudsave.config.ProviderType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class FirebaseStorageClient implements CloudStorageClient {

  private static final String PROVIDER = "firebase";
  private static final String DOCUMENTS = "/v1/projects/{projectId}/databases/(default)/documents";
  private static final String SAVE_PATH = DOCUMENTS + "/users/{ownerId}/saves/slot_{slot}?key={apiKey}";
  private static final String SAVES_PATH = DOCUMENTS + "/users/{ownerId}/saves?key={apiKey}";
  private static final String PING_PATH = DOCUMENTS + "/users?pageSize=1&key={apiKey}";

  private final RestClient restClient;
  private final CloudSaveProperties.Firebase properties;
  private final SavePayloadCodec codec;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public FirebaseStorageClient(
      RestClient restClient,
      CloudSaveProperties.Firebase properties,
      ObjectMapper objectMapper,
      @Nullable SaveDataCompressor compressor) {
    this.restClient = restClient;
    this.properties = properties;
    this.codec = new SavePayloadCodec(objectMapper, compressor);
  }

  @Override
  public ProviderType provider() {
    return ProviderType.FIREBASE;
  }

  @Override
  public SaveReceipt save(CloudSave save) {
    final CompressedPayload payload = codec.encode(save.gameState());
    final ObjectNode fields = JsonNodeFactory.instance.objectNode();
    fields.putObject("slotNumber").put("integerValue", Integer.toString(save.slotNumber()));
    fields.putObject("saveName").put("stringValue", save.saveName());
    fields.putObject("payload").put("stringValue", payload.data());
    fields.putObject("compressed").put("booleanValue", payload.compressed());
    fields.putObject("checksum").put("stringValue", save.checksum());
    fields.putObject("updatedAt").put("timestampValue", save.updatedAt().toString());
    final ObjectNode document = JsonNodeFactory.instance.objectNode();
    document.set("fields", fields);
    try {
      restClient
          .patch()
          .uri(SAVE_PATH, properties.projectId(), save.ownerId(), save.slotNumber(), properties.apiKey())
          .contentType(MediaType.APPLICATION_JSON)
          .body(document)
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
    final JsonNode document;
    try {
      document =
          restClient
              .get()
              .uri(SAVE_PATH, properties.projectId(), ownerId, slotNumber, properties.apiKey())
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        return Optional.empty();
      }
      throw StorageErrors.fromResponse(PROVIDER, "load", ex);
    } catch (ResourceAccessException ex) {
      throw StorageErrors.fromResourceAccess(PROVIDER, "load", ex);
    }
    if (document == null) {
      return Optional.empty();
    }
    return Optional.of(toCloudSave(ownerId, document));
  }

  @Override
  public boolean delete(String ownerId, int slotNumber) {
    try {
      restClient
          .delete()
          .uri(SAVE_PATH, properties.projectId(), ownerId, slotNumber, properties.apiKey())
          .retrieve()
          .toBodilessEntity();
      return true;
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        return false;
      }
      throw StorageErrors.fromResponse(PROVIDER, "delete", ex);
    } catch (ResourceAccessException ex) {
      throw StorageErrors.fromResourceAccess(PROVIDER, "delete", ex);
    }
  }

  @Override
  public List<CloudSaveSummary> list(String ownerId) {
    final JsonNode response;
    try {
      response =
          restClient
              .get()
              .uri(SAVES_PATH, properties.projectId(), ownerId, properties.apiKey())
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientResponseException ex) {
      throw StorageErrors.fromResponse(PROVIDER, "list", ex);
    } catch (ResourceAccessException ex) {
      throw StorageErrors.fromResourceAccess(PROVIDER, "list", ex);
    }
    final List<CloudSaveSummary> summaries = new ArrayList<>();
    if (response == null || !response.path("documents").isArray()) {
      // 空のコレクションでは documents 自体が返らない
      return summaries;
    }
    for (JsonNode document : response.path("documents")) {
      final JsonNode fields = document.path("fields");
      summaries.add(
          new CloudSaveSummary(
              fields.path("slotNumber").path("integerValue").asInt(),
              fields.path("saveName").path("stringValue").asText(null),
              fields.path("checksum").path("stringValue").asText(null),
              parseInstant(fields.path("updatedAt").path("timestampValue").asText(null))));
    }
    return summaries;
  }

  @Override
  public ConnectionCheckResult checkConnection() {
    final long startedAt = System.nanoTime();
    try {
      restClient
          .get()
          .uri(PING_PATH, properties.projectId(), properties.apiKey())
          .retrieve()
          .toBodilessEntity();
      return ConnectionCheckResult.connected(elapsedSince(startedAt));
    } catch (RestClientResponseException ex) {
      return ConnectionCheckResult.failed(
          "firebase responded with status " + ex.getStatusCode().value(), elapsedSince(startedAt));
    } catch (RuntimeException ex) {
      return ConnectionCheckResult.failed(ex.getMessage(), elapsedSince(startedAt));
    }
  }

  private CloudSave toCloudSave(String ownerId, JsonNode document) {
    final JsonNode fields = document.path("fields");
    try {
      final boolean compressed = fields.path("compressed").path("booleanValue").asBoolean(false);
      final String data = fields.path("payload").path("stringValue").asText(null);
      if (data == null) {
        throw new IllegalStateException("payload field is missing");
      }
      return new CloudSave(
          ownerId,
          fields.path("slotNumber").path("integerValue").asInt(),
          fields.path("saveName").path("stringValue").asText(null),
          codec.decode(data, compressed),
          fields.path("checksum").path("stringValue").asText(null),
          parseInstant(fields.path("updatedAt").path("timestampValue").asText(null)));
    } catch (JsonProcessingException | IllegalStateException ex) {
      throw StorageErrors.invalidResponse(PROVIDER, "load", ex);
    }
  }

  private static Instant parseInstant(String value) {
    if (value == null) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  private static Duration elapsedSince(long startedAt) {
    return Duration.ofNanos(System.nanoTime() - startedAt);
  }
}
