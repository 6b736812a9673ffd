/*
 * どこで: Cloud Save ストレージ連携
 * 何を: REST 呼び出しの失敗を分類コード付き OperationException へ変換する
 * なぜ: プロバイダが違っても再試行可否の判断をキュー側で統一するため
 */
package com.example.cloudsave.storage;

import com.example.cloudsave.error.CloudErrorCode;
import com.example.cloudsave.error.ErrorSeverity;
import com.example.cloudsave.error.OperationException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

final class StorageErrors {

  private static final Logger logger = LoggerFactory.getLogger(StorageErrors.class);

  private StorageErrors() {}

  static OperationException fromResponse(
      String provider, String action, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "{} {} failed with http status={} statusText={}",
        provider,
        action,
        status,
        ex.getStatusText());
    final String message = provider + " " + action + " failed with status " + status;
    if (status == 401 || status == 403) {
      return OperationException.nonRetryable(
          CloudErrorCode.STORAGE_PERMISSION_DENIED, ErrorSeverity.HIGH, message, ex);
    }
    if (status == 404) {
      return OperationException.nonRetryable(
          CloudErrorCode.STORAGE_NOT_FOUND, ErrorSeverity.MEDIUM, message, ex);
    }
    if (status == 408) {
      return OperationException.retryable(CloudErrorCode.NETWORK_TIMEOUT, message, ex);
    }
    if (status == 413) {
      return OperationException.nonRetryable(
          CloudErrorCode.DATA_TOO_LARGE, ErrorSeverity.MEDIUM, message, ex);
    }
    if (status == 429) {
      return OperationException.retryable(CloudErrorCode.STORAGE_QUOTA_EXCEEDED, message, ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return OperationException.retryable(CloudErrorCode.NETWORK_UNAVAILABLE, message, ex);
    }
    return OperationException.nonRetryable(
        CloudErrorCode.OPERATION_FAILED, ErrorSeverity.MEDIUM, message, ex);
  }

  static OperationException fromResourceAccess(
      String provider, String action, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("{} {} timed out", provider, action);
      return OperationException.retryable(
          CloudErrorCode.NETWORK_TIMEOUT, provider + " " + action + " timeout", ex);
    }
    logger.warn("{} {} connection failed", provider, action, ex);
    return OperationException.retryable(
        CloudErrorCode.NETWORK_ERROR, provider + " " + action + " connection failed", ex);
  }

  static OperationException invalidResponse(String provider, String action, Throwable cause) {
    logger.warn("{} {} response parse failed", provider, action, cause);
    return OperationException.nonRetryable(
        CloudErrorCode.DATA_CORRUPTED,
        ErrorSeverity.HIGH,
        provider + " " + action + " returned an invalid response",
        cause);
  }

  private static boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
