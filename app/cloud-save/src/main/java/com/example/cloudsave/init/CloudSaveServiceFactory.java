/*
 * どこで: Cloud Save 起動オーケストレーション
 * 何を: 確定した設定から監視・キュー・圧縮・ストレージクライアントを組み立てる
 * なぜ: サービス生成を初期化フローから切り離し、機能フラグごとの有効/無効を一箇所で決めるため
 */
package com.example.cloudsave.init;

import com.example.cloudsave.config.CloudSaveProperties;
import com.example.cloudsave.integrity.IntegrityValidator;
import com.example.cloudsave.integrity.SaveDataSchema;
import com.example.cloudsave.metrics.CloudSaveMetrics;
import com.example.cloudsave.network.HttpConnectivityProbe;
import com.example.cloudsave.network.NetworkInterfaceConnectivitySource;
import com.example.cloudsave.network.NetworkMonitor;
import com.example.cloudsave.network.PassiveConnectivitySource;
import com.example.cloudsave.queue.FileOperationQueueStore;
import com.example.cloudsave.queue.InMemoryOperationQueueStore;
import com.example.cloudsave.queue.OperationExecutor;
import com.example.cloudsave.queue.OperationExecutorRegistry;
import com.example.cloudsave.queue.OperationQueue;
import com.example.cloudsave.queue.OperationQueueStore;
import com.example.cloudsave.storage.CloudStorageClient;
import com.example.cloudsave.storage.CustomOperationExecutor;
import com.example.cloudsave.storage.CustomOperationHandler;
import com.example.cloudsave.storage.DeleteOperationExecutor;
import com.example.cloudsave.storage.FirebaseStorageClient;
import com.example.cloudsave.storage.LoadOperationExecutor;
import com.example.cloudsave.storage.SaveDataCompressor;
import com.example.cloudsave.storage.SaveOperationExecutor;
import com.example.cloudsave.storage.SupabaseStorageClient;
import com.example.cloudsave.storage.SyncOperationExecutor;
import com.example.common.time.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class CloudSaveServiceFactory {

  private static final Logger logger = LoggerFactory.getLogger(CloudSaveServiceFactory.class);

  private final RestClient.Builder restClientBuilder;
  private final TaskScheduler taskScheduler;
  private final Sleeper sleeper;
  private final Clock clock;
  private final ObjectMapper objectMapper;
  private final CloudSaveMetrics metrics;
  private final PassiveConnectivitySource passiveSource;
  private final List<CustomOperationHandler> customHandlers;

  @Autowired
  public CloudSaveServiceFactory(
      RestClient.Builder restClientBuilder,
      TaskScheduler taskScheduler,
      Sleeper sleeper,
      Clock clock,
      ObjectMapper objectMapper,
      CloudSaveMetrics metrics,
      ObjectProvider<PassiveConnectivitySource> passiveSource,
      ObjectProvider<CustomOperationHandler> customHandlers) {
    this(
        restClientBuilder,
        taskScheduler,
        sleeper,
        clock,
        objectMapper,
        metrics,
        passiveSource.getIfAvailable(NetworkInterfaceConnectivitySource::new),
        customHandlers.orderedStream().toList());
  }

  CloudSaveServiceFactory(
      RestClient.Builder restClientBuilder,
      TaskScheduler taskScheduler,
      Sleeper sleeper,
      Clock clock,
      ObjectMapper objectMapper,
      CloudSaveMetrics metrics,
      PassiveConnectivitySource passiveSource,
      List<CustomOperationHandler> customHandlers) {
    this.restClientBuilder = restClientBuilder;
    this.taskScheduler = taskScheduler;
    this.sleeper = sleeper;
    this.clock = clock;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.passiveSource = passiveSource;
    this.customHandlers = List.copyOf(customHandlers);
  }

  public CloudSaveServices create(CloudSaveProperties config) {
    final CloudSaveProperties.Features features = config.features();
    final IntegrityValidator integrityValidator = new IntegrityValidator(objectMapper, clock);
    final SaveDataCompressor compressor =
        features.compression() ? new SaveDataCompressor(config.compression()) : null;

    NetworkMonitor networkMonitor = null;
    if (features.networkMonitoring()) {
      networkMonitor =
          new NetworkMonitor(
              config.network(),
              passiveSource,
              HttpConnectivityProbe.create(restClientBuilder, config.network()),
              taskScheduler,
              sleeper,
              clock,
              metrics);
      networkMonitor.start();
    }

    final CloudStorageClient storageClient = createStorageClient(config, compressor);

    final List<ExecutorService> ownedExecutors = new ArrayList<>();
    OperationQueue operationQueue = null;
    if (features.offlineQueue()) {
      final ExecutorService drainExecutor =
          Executors.newSingleThreadExecutor(threadFactory("cloud-save-drain-%d"));
      final ExecutorService operationExecutor =
          Executors.newFixedThreadPool(
              config.queue().processingConcurrency(), threadFactory("cloud-save-op-%d"));
      ownedExecutors.add(drainExecutor);
      ownedExecutors.add(operationExecutor);
      operationQueue =
          new OperationQueue(
              config.queue(),
              features.autoRetry(),
              createQueueStore(config.queue()),
              new OperationExecutorRegistry(
                  createExecutors(config, storageClient, integrityValidator)),
              networkMonitor,
              taskScheduler,
              drainExecutor,
              operationExecutor,
              clock,
              metrics);
      operationQueue.start();
    }

    logger.info(
        "cloud save services created provider={} storage={} compression={} monitor={} queue={}",
        config.provider().type().value(),
        storageClient != null,
        compressor != null,
        networkMonitor != null,
        operationQueue != null);
    return new CloudSaveServices(
        config,
        integrityValidator,
        compressor,
        networkMonitor,
        operationQueue,
        storageClient,
        ownedExecutors);
  }

  @Nullable
  CloudStorageClient createStorageClient(
      CloudSaveProperties config, @Nullable SaveDataCompressor compressor) {
    final CloudSaveProperties.Provider provider = config.provider();
    if (!provider.isStorageEnabled()) {
      return null;
    }
    final JdkClientHttpRequestFactory requestFactory = requestFactory(config.settings());
    return switch (provider.type()) {
      case FIREBASE ->
          new FirebaseStorageClient(
              restClientBuilder
                  .clone()
                  .baseUrl(provider.firebase().resolvedBaseUrl())
                  .requestFactory(requestFactory)
                  .build(),
              provider.firebase(),
              objectMapper,
              compressor);
      case SUPABASE ->
          new SupabaseStorageClient(
              restClientBuilder
                  .clone()
                  .baseUrl(provider.supabase().url())
                  .requestFactory(requestFactory)
                  .build(),
              provider.supabase(),
              objectMapper,
              compressor);
      case NONE -> null;
    };
  }

  private List<OperationExecutor> createExecutors(
      CloudSaveProperties config,
      @Nullable CloudStorageClient storageClient,
      IntegrityValidator integrityValidator) {
    final List<OperationExecutor> executors = new ArrayList<>();
    executors.add(new CustomOperationExecutor(customHandlers));
    if (storageClient == null) {
      // ストレージ未設定時は save/load/delete/sync を登録せず、実行時に非リトライ失敗とする
      return executors;
    }
    final SaveDataSchema schema = SaveDataSchema.gameStateDefault();
    final long maxSaveSize = config.settings().maxSaveSize();
    executors.add(
        new SaveOperationExecutor(
            storageClient, integrityValidator, schema, maxSaveSize, objectMapper, clock));
    executors.add(
        new LoadOperationExecutor(storageClient, integrityValidator, schema, objectMapper));
    executors.add(new DeleteOperationExecutor(storageClient, objectMapper));
    executors.add(
        new SyncOperationExecutor(
            storageClient, integrityValidator, schema, maxSaveSize, objectMapper, clock));
    return executors;
  }

  private OperationQueueStore createQueueStore(CloudSaveProperties.Queue queue) {
    if (!queue.persistenceEnabled()) {
      return new InMemoryOperationQueueStore();
    }
    return new FileOperationQueueStore(Path.of(queue.storagePath()), objectMapper);
  }

  private static JdkClientHttpRequestFactory requestFactory(CloudSaveProperties.Settings settings) {
    final HttpClient httpClient =
        HttpClient.newBuilder().connectTimeout(settings.defaultTimeout()).build();
    final JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(settings.defaultTimeout());
    return requestFactory;
  }

  private static ThreadFactory threadFactory(String nameFormat) {
    return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
  }
}
