/*
 * どこで: 共通ユーティリティ
 * 何を: trace_id とキュー操作 ID を採番する
 * なぜ: ログと永続化レコードで同じ形式の ID を使うため
 */
package com.example.common;

import java.util.UUID;

public final class Ids {
  private static final String OPERATION_PREFIX = "op_";

  private Ids() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // ハイフンを落とした UUID を使い、ファイル名やクエリにそのまま載せられる形にする
  public static String newOperationId() {
    return OPERATION_PREFIX + UUID.randomUUID().toString().replace("-", "");
  }
}
