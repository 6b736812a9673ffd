/*
 * どこで: Cloud Save 設定読み込み
 * 何を: 既定値・環境変数・呼び出し側上書きを JSON ツリー上で深いマージし、設定レコードへ戻す
 * なぜ: 部分的な上書きでも未指定項目の既定値を失わないようにするため
 */
package com.example.cloudsave.config;

import com.example.cloudsave.error.ConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CloudSaveConfigLoader {

  private final CloudSaveProperties defaults;
  private final EnvironmentConfigOverlay environmentOverlay;
  private final ObjectMapper objectMapper;

  public CloudSaveProperties load(@Nullable JsonNode overrides) {
    if (overrides != null && !overrides.isNull() && !overrides.isObject()) {
      throw new ConfigurationException("custom configuration must be a JSON object");
    }
    final ObjectNode merged = objectMapper.valueToTree(defaults);
    deepMerge(merged, environmentOverlay.read());
    if (overrides != null && overrides.isObject()) {
      deepMerge(merged, (ObjectNode) overrides);
    }
    try {
      return objectMapper
          .readerFor(CloudSaveProperties.class)
          .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .readValue(merged);
    } catch (IOException | IllegalArgumentException ex) {
      throw new ConfigurationException(
          "failed to bind cloud save configuration: " + ex.getMessage(), ex);
    }
  }

  static void deepMerge(ObjectNode target, ObjectNode overlay) {
    final Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      final JsonNode current = target.get(field.getKey());
      if (current instanceof ObjectNode currentObject && field.getValue() instanceof ObjectNode next) {
        deepMerge(currentObject, next);
      } else {
        // 配列とスカラーは丸ごと置き換える
        target.set(field.getKey(), field.getValue().deepCopy());
      }
    }
  }
}
