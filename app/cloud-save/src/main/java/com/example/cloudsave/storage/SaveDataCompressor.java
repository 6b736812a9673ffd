/*
 * どこで: Cloud Save ストレージ連携
 * 何を: セーブデータ JSON を GZIP + Base64 で圧縮/展開する
 * なぜ: 転送量とストレージ使用量を抑えつつ、効果の薄い圧縮は避けるため
 */
package com.example.cloudsave.storage;

import com.example.cloudsave.config.CloudSaveProperties;
import com.example.cloudsave.error.CloudErrorCode;
import com.example.cloudsave.error.ErrorSeverity;
import com.example.cloudsave.error.OperationException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

public class SaveDataCompressor {

  private final CloudSaveProperties.Compression properties;

  public SaveDataCompressor(CloudSaveProperties.Compression properties) {
    this.properties = properties;
  }

  /** Returns the input unchanged when compression saves less than {@code minimum-compression-ratio}. */
  public CompressedPayload compress(String json) {
    final byte[] original = json.getBytes(StandardCharsets.UTF_8);
    final String encoded = Base64.getEncoder().encodeToString(gzip(original));
    final double saved = original.length == 0 ? 0 : 1.0 - ((double) encoded.length() / original.length);
    if (saved < properties.minimumCompressionRatio()) {
      return new CompressedPayload(json, false, original.length, original.length);
    }
    return new CompressedPayload(encoded, true, original.length, encoded.length());
  }

  public String decompress(String data, boolean compressed) {
    if (!compressed) {
      return data;
    }
    try (InputStream input =
        new GZIPInputStream(new ByteArrayInputStream(Base64.getDecoder().decode(data)))) {
      return new String(input.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException | IllegalArgumentException ex) {
      throw OperationException.nonRetryable(
          CloudErrorCode.DATA_CORRUPTED, ErrorSeverity.HIGH, "failed to decompress save data", ex);
    }
  }

  private byte[] gzip(byte[] input) {
    final ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(32, input.length / 2));
    final int level = properties.level().deflaterLevel();
    try (GZIPOutputStream output =
        new GZIPOutputStream(buffer) {
          {
            def.setLevel(level);
          }
        }) {
      output.write(input);
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to compress save data", ex);
    }
    return buffer.toByteArray();
  }
}
