package com.example.cloudsave.storage;

import com.example.cloudsave.config.CloudSaveProperties;
import com.example.cloudsave.error.CloudErrorCode;
import com.example.cloudsave.error.ErrorSeverity;
import com.example.cloudsave.error.OperationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.lang.Nullable;

/** Game state JSON to stored text and back, compressing when a compressor is configured. */
final class SavePayloadCodec {

  private final ObjectMapper objectMapper;
  @Nullable private final SaveDataCompressor compressor;
  private final SaveDataCompressor decoder;

  SavePayloadCodec(ObjectMapper objectMapper, @Nullable SaveDataCompressor compressor) {
    this.objectMapper = objectMapper;
    this.compressor = compressor;
    // 圧縮を無効にした後でも、以前に圧縮保存したデータは読めるようにする
    this.decoder =
        compressor != null
            ? compressor
            : new SaveDataCompressor(new CloudSaveProperties.Compression(null, null));
  }

  CompressedPayload encode(JsonNode gameState) {
    final String json;
    try {
      json = objectMapper.writeValueAsString(gameState);
    } catch (JsonProcessingException ex) {
      throw OperationException.nonRetryable(
          CloudErrorCode.DATA_INVALID, ErrorSeverity.MEDIUM, "game state is not serializable", ex);
    }
    if (compressor == null) {
      return new CompressedPayload(json, false, json.length(), json.length());
    }
    return compressor.compress(json);
  }

  JsonNode decode(String data, boolean compressed) throws JsonProcessingException {
    return objectMapper.readTree(decoder.decompress(data, compressed));
  }
}
