/*
 * どこで: Cloud Save ストレージ連携
 * 何を: プロバイダごとのセーブデータ保存/取得/削除/一覧/疎通確認の契約を定義する
 * なぜ: キュー実行器をプロバイダの REST 仕様から切り離すため
 */
package com.example.cloudsave.storage;

import com.example.cloudsave.config.ProviderType;
import java.util.List;
import java.util.Optional;

/** Failures are reported as {@link com.example.cloudsave.error.OperationException}. */
public interface CloudStorageClient {

  ProviderType provider();

  SaveReceipt save(CloudSave save);

  Optional<CloudSave> load(String ownerId, int slotNumber);

  boolean delete(String ownerId, int slotNumber);

  List<CloudSaveSummary> list(String ownerId);

  /** Never throws. */
  ConnectionCheckResult checkConnection();
}
