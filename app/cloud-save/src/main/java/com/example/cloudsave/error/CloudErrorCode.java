/*
 * どこで: Cloud Save エラー分類
 * 何を: 操作失敗の分類コードを定義する
 * なぜ: ログ・メトリクス・コールバックで同じ分類を使うため
 */
package com.example.cloudsave.error;

public enum CloudErrorCode {
  NETWORK_UNAVAILABLE("network/unavailable"),
  NETWORK_TIMEOUT("network/timeout"),
  NETWORK_ERROR("network/error"),
  AUTH_REQUIRED("auth/required"),
  STORAGE_QUOTA_EXCEEDED("storage/quota-exceeded"),
  STORAGE_PERMISSION_DENIED("storage/permission-denied"),
  STORAGE_NOT_FOUND("storage/not-found"),
  DATA_CORRUPTED("data/corrupted"),
  DATA_INVALID("data/invalid"),
  DATA_TOO_LARGE("data/too-large"),
  DATA_CHECKSUM_MISMATCH("data/checksum-mismatch"),
  OPERATION_TIMEOUT("operation/timeout"),
  OPERATION_CANCELLED("operation/cancelled"),
  OPERATION_FAILED("operation/failed"),
  UNKNOWN("unknown");

  private final String value;

  CloudErrorCode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
