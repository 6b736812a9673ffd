package com.example.cloudsave.init;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.function.Consumer;
import org.springframework.lang.Nullable;

/**
 * Per-call initialization options.
 *
 * @param customConfig partial configuration tree deep-merged over defaults and environment
 */
public record InitializationOptions(
    boolean skipConnectionTest,
    boolean enableDebugLogging,
    @Nullable JsonNode customConfig,
    @Nullable Consumer<InitializationProgress> onProgress,
    @Nullable Consumer<String> onWarning,
    @Nullable Consumer<RuntimeException> onError) {

  public static InitializationOptions defaults() {
    return new InitializationOptions(false, false, null, null, null, null);
  }

  public InitializationOptions withSkipConnectionTest() {
    return new InitializationOptions(
        true, enableDebugLogging, customConfig, onProgress, onWarning, onError);
  }

  public InitializationOptions withDebugLogging() {
    return new InitializationOptions(
        skipConnectionTest, true, customConfig, onProgress, onWarning, onError);
  }

  public InitializationOptions withCustomConfig(JsonNode config) {
    return new InitializationOptions(
        skipConnectionTest, enableDebugLogging, config, onProgress, onWarning, onError);
  }

  public InitializationOptions withOnProgress(Consumer<InitializationProgress> listener) {
    return new InitializationOptions(
        skipConnectionTest, enableDebugLogging, customConfig, listener, onWarning, onError);
  }

  public InitializationOptions withOnWarning(Consumer<String> listener) {
    return new InitializationOptions(
        skipConnectionTest, enableDebugLogging, customConfig, onProgress, listener, onError);
  }

  public InitializationOptions withOnError(Consumer<RuntimeException> listener) {
    return new InitializationOptions(
        skipConnectionTest, enableDebugLogging, customConfig, onProgress, onWarning, listener);
  }
}
