package com.example.cloudsave.integrity;

/**
 * @param strictMode warnings also make the result invalid
 * @param maxDataSize upper bound for the serialized JSON size in bytes, {@code null} for none
 */
public record ValidationOptions(
    boolean deepValidation, boolean enableRecovery, boolean strictMode, Long maxDataSize) {

  public static ValidationOptions defaults() {
    return new ValidationOptions(false, false, false, null);
  }

  public ValidationOptions withDeepValidation() {
    return new ValidationOptions(true, enableRecovery, strictMode, maxDataSize);
  }

  public ValidationOptions withRecovery() {
    return new ValidationOptions(deepValidation, true, strictMode, maxDataSize);
  }

  public ValidationOptions withStrictMode() {
    return new ValidationOptions(deepValidation, enableRecovery, true, maxDataSize);
  }

  public ValidationOptions withMaxDataSize(Long bytes) {
    return new ValidationOptions(deepValidation, enableRecovery, strictMode, bytes);
  }
}
