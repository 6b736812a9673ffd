/*
 * どこで: Cloud Save 起動オーケストレーション
 * 何を: 初期化で組み立てたサービス群 (監視・キュー・圧縮・ストレージ) を保持する
 * なぜ: 機能フラグで無効なサービスを null ではなく Optional で呼び出し側へ渡すため
 */
package com.example.cloudsave.init;

import com.example.cloudsave.config.CloudSaveProperties;
import com.example.cloudsave.integrity.IntegrityValidator;
import com.example.cloudsave.network.NetworkMonitor;
import com.example.cloudsave.queue.OperationQueue;
import com.example.cloudsave.storage.CloudStorageClient;
import com.example.cloudsave.storage.SaveDataCompressor;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import org.springframework.lang.Nullable;

public class CloudSaveServices {

  private final CloudSaveProperties config;
  private final IntegrityValidator integrityValidator;
  @Nullable private final SaveDataCompressor compressor;
  @Nullable private final NetworkMonitor networkMonitor;
  @Nullable private final OperationQueue operationQueue;
  @Nullable private final CloudStorageClient storageClient;
  private final List<ExecutorService> ownedExecutors;

  public CloudSaveServices(
      CloudSaveProperties config,
      IntegrityValidator integrityValidator,
      @Nullable SaveDataCompressor compressor,
      @Nullable NetworkMonitor networkMonitor,
      @Nullable OperationQueue operationQueue,
      @Nullable CloudStorageClient storageClient,
      List<ExecutorService> ownedExecutors) {
    this.config = config;
    this.integrityValidator = integrityValidator;
    this.compressor = compressor;
    this.networkMonitor = networkMonitor;
    this.operationQueue = operationQueue;
    this.storageClient = storageClient;
    this.ownedExecutors = List.copyOf(ownedExecutors);
  }

  public CloudSaveProperties config() {
    return config;
  }

  public IntegrityValidator integrityValidator() {
    return integrityValidator;
  }

  public Optional<SaveDataCompressor> compressor() {
    return Optional.ofNullable(compressor);
  }

  public Optional<NetworkMonitor> networkMonitor() {
    return Optional.ofNullable(networkMonitor);
  }

  public Optional<OperationQueue> operationQueue() {
    return Optional.ofNullable(operationQueue);
  }

  public Optional<CloudStorageClient> storageClient() {
    return Optional.ofNullable(storageClient);
  }

  /**
   * Stops the queue (keeping its persisted snapshot), destroys the monitor and shuts down the
   * thread pools created for this set of services.
   */
  public void shutdown() {
    if (operationQueue != null) {
      operationQueue.shutdown();
    }
    if (networkMonitor != null) {
      networkMonitor.destroy();
    }
    for (ExecutorService executor : ownedExecutors) {
      executor.shutdown();
    }
  }
}
