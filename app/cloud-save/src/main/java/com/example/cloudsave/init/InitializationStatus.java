/*
 * どこで: Cloud Save 起動オーケストレーション
 * 何を: 初期化の進行状態・有効機能・エラー/警告を不変スナップショットとして表す
 * なぜ: 状態取得 API とステータス画面が途中経過を安全に読めるようにするため
 */
package com.example.cloudsave.init;

import com.example.cloudsave.config.ProviderType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InitializationStatus(
    @JsonProperty("is_initialized") boolean isInitialized,
    @JsonProperty("is_configured") boolean isConfigured,
    @JsonProperty("is_connected") boolean isConnected,
    ProviderType provider,
    EnabledFeatures features,
    List<String> errors,
    List<String> warnings,
    Instant timestamp,
    InitializationPhase phase) {

  public InitializationStatus {
    features = features == null ? EnabledFeatures.none() : features;
    errors = errors == null ? List.of() : List.copyOf(errors);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static InitializationStatus idle(Instant now) {
    return new InitializationStatus(
        false,
        false,
        false,
        ProviderType.NONE,
        EnabledFeatures.none(),
        List.of(),
        List.of(),
        now,
        InitializationPhase.IDLE);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record EnabledFeatures(boolean compression, boolean offlineQueue, boolean networkMonitoring) {

    public static EnabledFeatures none() {
      return new EnabledFeatures(false, false, false);
    }
  }
}
