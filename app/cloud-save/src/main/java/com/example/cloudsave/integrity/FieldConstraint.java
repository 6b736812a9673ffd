package com.example.cloudsave.integrity;

/**
 * Per-path limits. {@code min}/{@code max} apply to numbers, {@code maxLength} to arrays and
 * strings. Any bound may be {@code null}.
 */
public record FieldConstraint(Double min, Double max, Integer maxLength) {

  public static FieldConstraint range(double min, double max) {
    return new FieldConstraint(min, max, null);
  }

  public static FieldConstraint maxLength(int maxLength) {
    return new FieldConstraint(null, null, maxLength);
  }
}
