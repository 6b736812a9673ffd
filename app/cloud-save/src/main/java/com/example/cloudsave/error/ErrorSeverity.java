package com.example.cloudsave.error;

public enum ErrorSeverity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL
}
