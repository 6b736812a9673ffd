/*
 * どこで: Cloud Save 起動オーケストレーション
 * 何を: 設定読み込み → 検証 → サービス生成 → 接続確認 → 確定 の順に初期化を進める
 * なぜ: 各段階の失敗と警告を一つの状態スナップショットへ集約し、同時呼び出しでも一度だけ実行するため
 */
package com.example.cloudsave.init;

import com.example.cloudsave.config.CloudSaveConfigLoader;
import com.example.cloudsave.config.CloudSaveConfigValidator;
import com.example.cloudsave.config.CloudSaveProperties;
import com.example.cloudsave.config.ConfigValidationResult;
import com.example.cloudsave.config.ProviderType;
import com.example.cloudsave.error.ConfigurationException;
import com.example.cloudsave.metrics.CloudSaveMetrics;
import com.example.cloudsave.network.NetworkMonitor;
import com.example.cloudsave.storage.CloudStorageClient;
import com.example.cloudsave.storage.ConnectionCheckResult;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Multi-phase startup of the cloud save services.
 *
 * <p>Phases run in order {@code LOADING_CONFIG, VALIDATING_CONFIG, INITIALIZING_SERVICES,
 * TESTING_CONNECTIONS, FINALIZING} and end in {@code READY} or {@code FAILED}. Connection test
 * failures are warnings; configuration and service construction failures are fatal.
 *
 * <p>Concurrent {@link #initialize} calls share one in-flight run. Once {@code READY}, further calls
 * return the current status until {@link #cleanup()} or {@link #reinitialize}. A cleanup during a run
 * supersedes it: the services that run builds are stopped instead of published, and the next
 * {@link #initialize} starts a fresh run.
 */
@Component
public class CloudSaveInitializer {

  private static final Logger logger = LoggerFactory.getLogger(CloudSaveInitializer.class);

  static final String NO_INTERNET_WARNING = "No internet connection detected";

  private final CloudSaveConfigLoader configLoader;
  private final CloudSaveConfigValidator configValidator;
  private final CloudSaveServiceFactory serviceFactory;
  private final CloudSaveMetrics metrics;
  private final Clock clock;

  private InitializationStatus status;
  private CloudSaveServices services;
  private CompletableFuture<InitializationStatus> inFlight;
  // cleanup() ごとに進む。古い世代の実行は状態もサービスも確定できない
  private long generation;

  public CloudSaveInitializer(
      CloudSaveConfigLoader configLoader,
      CloudSaveConfigValidator configValidator,
      CloudSaveServiceFactory serviceFactory,
      CloudSaveMetrics metrics,
      Clock clock) {
    this.configLoader = configLoader;
    this.configValidator = configValidator;
    this.serviceFactory = serviceFactory;
    this.metrics = metrics;
    this.clock = clock;
    this.status = InitializationStatus.idle(clock.instant());
  }

  public CompletableFuture<InitializationStatus> initialize(InitializationOptions options) {
    final CompletableFuture<InitializationStatus> future;
    final long runGeneration;
    synchronized (this) {
      if (inFlight != null) {
        return inFlight;
      }
      if (status.isInitialized()) {
        return CompletableFuture.completedFuture(status);
      }
      future = new CompletableFuture<>();
      inFlight = future;
      runGeneration = generation;
    }
    try {
      final InitializationStatus result =
          perform(options == null ? InitializationOptions.defaults() : options, runGeneration);
      clearInFlight(future);
      future.complete(result);
    } catch (RuntimeException ex) {
      clearInFlight(future);
      future.completeExceptionally(ex);
    }
    return future;
  }

  public CompletableFuture<InitializationStatus> reinitialize(InitializationOptions options) {
    cleanup();
    return initialize(options);
  }

  /** Stops the services. The offline queue keeps its persisted snapshot for the next run. */
  @PreDestroy
  public void cleanup() {
    final CloudSaveServices previous;
    synchronized (this) {
      generation++;
      inFlight = null;
      previous = services;
      services = null;
      status =
          new InitializationStatus(
              false,
              status.isConfigured(),
              status.isConnected(),
              status.provider(),
              status.features(),
              status.errors(),
              status.warnings(),
              clock.instant(),
              InitializationPhase.IDLE);
    }
    if (previous != null) {
      previous.shutdown();
      logger.info("cloud save services stopped");
    }
  }

  public synchronized InitializationStatus getStatus() {
    return status;
  }

  public synchronized Optional<CloudSaveServices> getServices() {
    return Optional.ofNullable(services);
  }

  public synchronized boolean isInitialized() {
    return status.isInitialized();
  }

  public synchronized boolean isReady() {
    return status.isInitialized() && status.isConfigured() && status.errors().isEmpty();
  }

  public synchronized ConfigurationSummary getConfigurationSummary() {
    final String state;
    if (!status.isInitialized()) {
      state = "not initialized";
    } else {
      state = status.isConnected() ? "ready" : "offline";
    }
    final List<String> features = new ArrayList<>();
    if (status.features().compression()) {
      features.add("compression");
    }
    if (status.features().offlineQueue()) {
      features.add("offlineQueue");
    }
    if (status.features().networkMonitoring()) {
      features.add("networkMonitoring");
    }
    return new ConfigurationSummary(
        status.provider(), state, features, status.errors().size(), status.warnings().size());
  }

  private InitializationStatus perform(InitializationOptions options, long runGeneration) {
    final Draft draft = new Draft(runGeneration);
    CloudSaveServices created = null;
    try {
      advance(draft, InitializationPhase.LOADING_CONFIG, options, "Loading configuration", 10);
      final CloudSaveProperties config = configLoader.load(options.customConfig());
      draft.provider = config.provider().type();
      final boolean debug = options.enableDebugLogging() || config.debug();

      advance(draft, InitializationPhase.VALIDATING_CONFIG, options, "Validating configuration", 20);
      final ConfigValidationResult validation = configValidator.validate(config);
      if (!validation.isValid()) {
        draft.errors.addAll(validation.errors());
        throw new ConfigurationException(
            "configuration validation failed: " + String.join(", ", validation.errors()),
            validation.errors(),
            null);
      }
      validation.warnings().forEach(warning -> addWarning(draft, options, warning));
      draft.configured = config.provider().isStorageEnabled();
      if (debug) {
        logger.info(
            "cloud save configuration loaded environment={} provider={} configured={}",
            config.environment(),
            draft.provider.value(),
            draft.configured);
      }

      advance(draft, InitializationPhase.INITIALIZING_SERVICES, options, "Initializing services", 40);
      created = serviceFactory.create(config);
      draft.features =
          new InitializationStatus.EnabledFeatures(
              created.compressor().isPresent(),
              created.operationQueue().isPresent(),
              created.networkMonitor().isPresent());

      if (!options.skipConnectionTest()) {
        advance(draft, InitializationPhase.TESTING_CONNECTIONS, options, "Testing connections", 60);
        testConnections(created, draft, options);
      }

      advance(draft, InitializationPhase.FINALIZING, options, "Finalizing setup", 90);
      draft.initialized = true;
      if (!commit(created, runGeneration)) {
        created.shutdown();
        logger.info("cloud save initialization superseded by cleanup, built services stopped");
        return currentStatus();
      }
      advance(draft, InitializationPhase.READY, options, "Initialization complete", 100);
      metrics.recordInitialization("success");
      logger.info(
          "cloud save initialized provider={} configured={} connected={} warnings={}",
          draft.provider.value(),
          draft.configured,
          draft.connected,
          draft.warnings.size());
      return currentStatus();
    } catch (RuntimeException ex) {
      if (created != null) {
        created.shutdown();
      }
      final InitializationPhase failedPhase = draft.phase;
      draft.errors.add(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
      draft.initialized = false;
      draft.phase = InitializationPhase.FAILED;
      publish(draft);
      metrics.recordInitialization("failure");
      logger.error("cloud save initialization failed phase={}", failedPhase.value(), ex);
      invokeListener(options.onError(), ex);
      return currentStatus();
    }
  }

  private void testConnections(
      CloudSaveServices created, Draft draft, InitializationOptions options) {
    try {
      final Optional<NetworkMonitor> monitor = created.networkMonitor();
      if (monitor.isPresent() && !monitor.get().checkConnectivity()) {
        addWarning(draft, options, NO_INTERNET_WARNING);
      }
      final Optional<CloudStorageClient> storage = created.storageClient();
      if (storage.isEmpty()) {
        return;
      }
      final ConnectionCheckResult result = storage.get().checkConnection();
      final String label = label(storage.get().provider());
      if (result.connected()) {
        draft.connected = true;
        logger.info(
            "storage connection test succeeded provider={} latencyMs={}",
            storage.get().provider().value(),
            result.latency() == null ? null : result.latency().toMillis());
        return;
      }
      addWarning(draft, options, label + " connection test failed");
      if (result.error() != null) {
        addWarning(draft, options, label + " error: " + result.error());
      }
    } catch (RuntimeException ex) {
      addWarning(draft, options, "Connection test failed: " + ex.getMessage());
    }
  }

  private void advance(
      Draft draft, InitializationPhase phase, InitializationOptions options, String step, int percent) {
    draft.phase = phase;
    publish(draft);
    invokeListener(options.onProgress(), new InitializationProgress(step, percent));
  }

  private void addWarning(Draft draft, InitializationOptions options, String warning) {
    draft.warnings.add(warning);
    logger.warn("cloud save initialization warning message={}", warning);
    invokeListener(options.onWarning(), warning);
  }

  private synchronized boolean commit(CloudSaveServices created, long runGeneration) {
    if (runGeneration != generation) {
      return false;
    }
    services = created;
    return true;
  }

  private synchronized void publish(Draft draft) {
    if (draft.generation == generation) {
      status = draft.snapshot(clock);
    }
  }

  private synchronized InitializationStatus currentStatus() {
    return status;
  }

  private synchronized void clearInFlight(CompletableFuture<InitializationStatus> future) {
    if (inFlight == future) {
      inFlight = null;
    }
  }

  private static <T> void invokeListener(Consumer<T> listener, T value) {
    if (listener == null) {
      return;
    }
    try {
      listener.accept(value);
    } catch (RuntimeException ex) {
      logger.warn("initialization listener failed", ex);
    }
  }

  private static String label(ProviderType provider) {
    return switch (provider) {
      case FIREBASE -> "Firebase";
      case SUPABASE -> "Supabase";
      case NONE -> "Storage";
    };
  }

  // 初期化 1 回分の可変な途中状態
  private static final class Draft {
    private final long generation;
    private InitializationPhase phase = InitializationPhase.IDLE;
    private boolean initialized;
    private boolean configured;
    private boolean connected;
    private ProviderType provider = ProviderType.NONE;
    private InitializationStatus.EnabledFeatures features =
        InitializationStatus.EnabledFeatures.none();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    private Draft(long generation) {
      this.generation = generation;
    }

    private InitializationStatus snapshot(Clock clock) {
      return new InitializationStatus(
          initialized,
          configured,
          connected,
          provider,
          features,
          errors,
          warnings,
          clock.instant(),
          phase);
    }
  }
}
