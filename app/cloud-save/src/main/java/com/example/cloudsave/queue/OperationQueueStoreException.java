package com.example.cloudsave.queue;

public class OperationQueueStoreException extends RuntimeException {

  public OperationQueueStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
