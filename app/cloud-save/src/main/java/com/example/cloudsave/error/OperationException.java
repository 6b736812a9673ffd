/*
 * どこで: Cloud Save 操作実行
 * 何を: 実行器が投げる失敗を分類コード・再試行可否・深刻度付きで表現する
 * なぜ: キューが例外の型に依存せず再試行判断できるようにするため
 */
package com.example.cloudsave.error;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.springframework.web.client.ResourceAccessException;

public class OperationException extends RuntimeException {

  private final CloudErrorCode code;
  private final ErrorSeverity severity;
  private final boolean retryable;

  public OperationException(
      CloudErrorCode code,
      ErrorSeverity severity,
      boolean retryable,
      String message,
      Throwable cause) {
    super(message, cause);
    this.code = code;
    this.severity = severity;
    this.retryable = retryable;
  }

  public static OperationException retryable(CloudErrorCode code, String message) {
    return new OperationException(code, ErrorSeverity.MEDIUM, true, message, null);
  }

  public static OperationException retryable(
      CloudErrorCode code, String message, Throwable cause) {
    return new OperationException(code, ErrorSeverity.MEDIUM, true, message, cause);
  }

  public static OperationException nonRetryable(
      CloudErrorCode code, ErrorSeverity severity, String message) {
    return new OperationException(code, severity, false, message, null);
  }

  public static OperationException nonRetryable(
      CloudErrorCode code, ErrorSeverity severity, String message, Throwable cause) {
    return new OperationException(code, severity, false, message, cause);
  }

  /** Normalizes any failure raised by an executor. Unknown failures are treated as retryable. */
  public static OperationException from(Throwable error) {
    final Throwable unwrapped = unwrap(error);
    if (unwrapped instanceof OperationException operationException) {
      return operationException;
    }
    if (hasCause(unwrapped, SocketTimeoutException.class)
        || hasCause(unwrapped, HttpTimeoutException.class)
        || hasCause(unwrapped, TimeoutException.class)) {
      return retryable(CloudErrorCode.NETWORK_TIMEOUT, messageOf(unwrapped), unwrapped);
    }
    if (unwrapped instanceof ResourceAccessException
        || hasCause(unwrapped, ConnectException.class)
        || unwrapped instanceof IOException) {
      return retryable(CloudErrorCode.NETWORK_ERROR, messageOf(unwrapped), unwrapped);
    }
    if (unwrapped instanceof IllegalArgumentException) {
      return nonRetryable(
          CloudErrorCode.DATA_INVALID, ErrorSeverity.MEDIUM, messageOf(unwrapped), unwrapped);
    }
    final String message = messageOf(unwrapped).toLowerCase(Locale.ROOT);
    if (message.contains("timeout")) {
      return retryable(CloudErrorCode.OPERATION_TIMEOUT, messageOf(unwrapped), unwrapped);
    }
    if (message.contains("network")) {
      return retryable(CloudErrorCode.NETWORK_ERROR, messageOf(unwrapped), unwrapped);
    }
    return retryable(CloudErrorCode.UNKNOWN, messageOf(unwrapped), unwrapped);
  }

  public CloudErrorCode code() {
    return code;
  }

  public ErrorSeverity severity() {
    return severity;
  }

  public boolean retryable() {
    return retryable;
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
    Throwable current = error;
    while (current != null) {
      if (type.isInstance(current)) {
        return true;
      }
      if (current.getCause() == current) {
        return false;
      }
      current = current.getCause();
    }
    return false;
  }

  private static String messageOf(Throwable error) {
    final String message = error.getMessage();
    return message == null ? error.getClass().getSimpleName() : message;
  }
}
