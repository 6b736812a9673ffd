/*
 * どこで: Cloud Save API
 * 何を: 初期化状態・ネットワーク状態・オフラインキューの読み取り専用ビューを公開する
 * なぜ: 運用時にクライアント同期の状況を HTTP で確認できるようにするため
 */
package com.example.cloudsave.api;

import com.example.cloudsave.api.response.CloudSaveStatusResponse;
import com.example.cloudsave.api.response.NetworkStatusResponse;
import com.example.cloudsave.api.response.QueueSnapshotResponse;
import com.example.cloudsave.init.CloudSaveInitializer;
import com.example.cloudsave.init.CloudSaveServices;
import com.example.cloudsave.queue.OperationQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/cloud-save")
@RequiredArgsConstructor
public class CloudSaveStatusController {

  private final CloudSaveInitializer initializer;

  @GetMapping("/status")
  public ResponseEntity<CloudSaveStatusResponse> getStatus() {
    final NetworkStatusResponse network =
        initializer
            .getServices()
            .flatMap(CloudSaveServices::networkMonitor)
            .map(NetworkStatusResponse::from)
            .orElse(null);
    return ResponseEntity.ok(
        new CloudSaveStatusResponse(
            initializer.isReady(),
            initializer.getConfigurationSummary(),
            initializer.getStatus(),
            network));
  }

  @GetMapping("/queue")
  public ResponseEntity<QueueSnapshotResponse> getQueue(
      @RequestParam(name = "owner_id", required = false) String ownerId) {
    final OperationQueue queue =
        initializer
            .getServices()
            .flatMap(CloudSaveServices::operationQueue)
            .orElseThrow(() -> new ServicesNotReadyException("offline queue is not running"));
    return ResponseEntity.ok(
        new QueueSnapshotResponse(
            queue.getStatus(),
            ownerId == null || ownerId.isBlank()
                ? queue.getOperations()
                : queue.getOperationsByOwner(ownerId)));
  }
}
