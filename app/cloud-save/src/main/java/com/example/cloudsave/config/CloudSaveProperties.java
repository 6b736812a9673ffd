/*
 * どこで: Cloud Save 設定バインド
 * 何を: プロバイダ・機能フラグ・キュー・ネットワーク監視の既定値を保持する
 * なぜ: application.yml を既定値の単一の出所とし、環境変数と呼び出し側の上書きをその上に重ねるため
 */
package com.example.cloudsave.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "cloud-save")
@Validated
public record CloudSaveProperties(
    @NotBlank String environment,
    Boolean debug,
    Boolean autoInitialize,
    @NotNull @Valid Provider provider,
    @NotNull @Valid Features features,
    @NotNull @Valid Settings settings,
    @NotNull @Valid Queue queue,
    @NotNull @Valid Network network,
    @NotNull @Valid Compression compression) {

  public CloudSaveProperties {
    environment = environment == null || environment.isBlank() ? "development" : environment;
    debug = debug != null && debug;
    autoInitialize = autoInitialize != null && autoInitialize;
    provider = provider == null ? new Provider(null, null, null, null) : provider;
    features = features == null ? new Features(null, null, null, null, null, null) : features;
    settings = settings == null ? new Settings(null, null, null, null) : settings;
    queue = queue == null ? new Queue(null, null, null, null, null, null, null, null) : queue;
    network = network == null ? new Network(null, null, null, null, null, null) : network;
    compression = compression == null ? new Compression(null, null) : compression;
  }

  public static CloudSaveProperties defaults() {
    return new CloudSaveProperties(null, null, null, null, null, null, null, null, null);
  }

  @JsonIgnore
  public boolean isProduction() {
    return "production".equalsIgnoreCase(environment);
  }

  public record Provider(
      ProviderType type, Boolean enabled, @Valid Firebase firebase, @Valid Supabase supabase) {

    public Provider {
      type = type == null ? ProviderType.FIREBASE : type;
      enabled = enabled != null && enabled;
      firebase =
          firebase == null
              ? new Firebase(null, null, null, null, null, null, null, null, null, null)
              : firebase;
      supabase = supabase == null ? new Supabase(null, null, null, null) : supabase;
    }

    /** Enabled, a concrete provider is selected and its minimal credentials are present. */
    @JsonIgnore
    public boolean isStorageEnabled() {
      if (!enabled) {
        return false;
      }
      return switch (type) {
        case FIREBASE -> hasText(firebase.apiKey()) && hasText(firebase.projectId());
        case SUPABASE -> hasText(supabase.url()) && hasText(supabase.anonKey());
        case NONE -> false;
      };
    }
  }

  public record Firebase(
      String apiKey,
      String authDomain,
      String projectId,
      String storageBucket,
      String messagingSenderId,
      String appId,
      String measurementId,
      Boolean useEmulator,
      String emulatorHost,
      String baseUrl) {

    public Firebase {
      useEmulator = useEmulator != null && useEmulator;
      baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://firestore.googleapis.com" : baseUrl;
    }

    @JsonIgnore
    public String resolvedBaseUrl() {
      if (useEmulator && hasText(emulatorHost)) {
        return emulatorHost.startsWith("http") ? emulatorHost : "http://" + emulatorHost;
      }
      return baseUrl;
    }
  }

  public record Supabase(String url, String anonKey, String serviceRoleKey, String table) {

    public Supabase {
      table = table == null || table.isBlank() ? "cloud_saves" : table;
    }
  }

  public record Features(
      Boolean compression,
      Boolean offlineQueue,
      Boolean networkMonitoring,
      Boolean autoRetry,
      Boolean analytics,
      Boolean encryption) {

    public Features {
      compression = compression == null || compression;
      offlineQueue = offlineQueue == null || offlineQueue;
      networkMonitoring = networkMonitoring == null || networkMonitoring;
      autoRetry = autoRetry == null || autoRetry;
      analytics = analytics != null && analytics;
      encryption = encryption != null && encryption;
    }
  }

  public record Settings(
      @NotNull @Positive Long maxSaveSize,
      @NotNull Duration defaultTimeout,
      @NotNull @Min(1) Integer retryAttempts,
      @NotNull Duration retryDelay) {

    public Settings {
      maxSaveSize = maxSaveSize == null ? 50L * 1024 * 1024 : maxSaveSize;
      defaultTimeout = defaultTimeout == null ? Duration.ofSeconds(30) : defaultTimeout;
      retryAttempts = retryAttempts == null ? 3 : retryAttempts;
      retryDelay = retryDelay == null ? Duration.ofSeconds(1) : retryDelay;
    }

    @JsonIgnore
    @AssertTrue(message = "cloud-save.settings.default-timeout must be positive")
    public boolean isDefaultTimeoutPositive() {
      return isPositive(defaultTimeout);
    }

    @JsonIgnore
    @AssertTrue(message = "cloud-save.settings.retry-delay must not be negative")
    public boolean isRetryDelayNotNegative() {
      return retryDelay != null && !retryDelay.isNegative();
    }
  }

  public record Queue(
      @NotNull @Min(1) Integer maxQueueSize,
      @NotNull @Min(1) Integer maxRetries,
      @NotNull Duration retryDelay,
      @NotNull Duration maxRetryDelay,
      @NotNull @Min(1) @Max(32) Integer processingConcurrency,
      Boolean autoProcessOnline,
      Boolean persistenceEnabled,
      String storagePath) {

    public Queue {
      maxQueueSize = maxQueueSize == null ? 100 : maxQueueSize;
      maxRetries = maxRetries == null ? 3 : maxRetries;
      retryDelay = retryDelay == null ? Duration.ofSeconds(1) : retryDelay;
      maxRetryDelay = maxRetryDelay == null ? Duration.ofSeconds(30) : maxRetryDelay;
      processingConcurrency = processingConcurrency == null ? 3 : processingConcurrency;
      autoProcessOnline = autoProcessOnline == null || autoProcessOnline;
      persistenceEnabled = persistenceEnabled == null || persistenceEnabled;
      storagePath =
          storagePath == null || storagePath.isBlank()
              ? "data/cloud_save_offline_queue.json"
              : storagePath;
    }

    @JsonIgnore
    @AssertTrue(message = "cloud-save.queue.retry-delay must be positive")
    public boolean isRetryDelayPositive() {
      return isPositive(retryDelay);
    }

    @JsonIgnore
    @AssertTrue(message = "cloud-save.queue.max-retry-delay must not be shorter than retry-delay")
    public boolean isMaxRetryDelayConsistent() {
      // null は @NotNull で検出する
      return retryDelay == null || maxRetryDelay == null || maxRetryDelay.compareTo(retryDelay) >= 0;
    }
  }

  public record Network(
      @NotBlank String pingUrl,
      @NotNull Duration pingInterval,
      @NotNull Duration pingTimeout,
      @NotNull @Min(1) Integer retryAttempts,
      @NotNull Duration probeBackoffBase,
      Boolean enableDetailedInfo) {

    public Network {
      pingUrl = pingUrl == null || pingUrl.isBlank() ? "https://www.google.com/favicon.ico" : pingUrl;
      pingInterval = pingInterval == null ? Duration.ofSeconds(30) : pingInterval;
      pingTimeout = pingTimeout == null ? Duration.ofSeconds(5) : pingTimeout;
      retryAttempts = retryAttempts == null ? 3 : retryAttempts;
      probeBackoffBase = probeBackoffBase == null ? Duration.ofSeconds(1) : probeBackoffBase;
      enableDetailedInfo = enableDetailedInfo == null || enableDetailedInfo;
    }

    @JsonIgnore
    @AssertTrue(message = "cloud-save.network.ping-timeout must be positive")
    public boolean isPingTimeoutPositive() {
      return isPositive(pingTimeout);
    }

    @JsonIgnore
    @AssertTrue(message = "cloud-save.network.ping-interval must not be negative")
    public boolean isPingIntervalNotNegative() {
      // 0 は定期プローブ無効を表す
      return pingInterval != null && !pingInterval.isNegative();
    }
  }

  public record Compression(
      CompressionLevel level,
      @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double minimumCompressionRatio) {

    public Compression {
      level = level == null ? CompressionLevel.BALANCED : level;
      minimumCompressionRatio = minimumCompressionRatio == null ? 0.1 : minimumCompressionRatio;
    }
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
