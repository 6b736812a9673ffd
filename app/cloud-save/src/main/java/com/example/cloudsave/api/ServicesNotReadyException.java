package com.example.cloudsave.api;

public class ServicesNotReadyException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ServicesNotReadyException(String message) {
    super(message);
  }
}
