package com.example.fieldkb.router.validation;

import java.util.List;
import java.util.Objects;

/** Thrown when a request cannot be routed; carries the reasons returned to the caller. */
public class ValidationException extends RuntimeException {

  private final List<String> reasons;

  public ValidationException(String message) {
    super(Objects.requireNonNull(message, "message"));
    this.reasons = List.of(message);
  }

  public ValidationException(List<String> reasons) {
    super(join(reasons));
    this.reasons = List.copyOf(reasons);
  }

  public List<String> getReasons() {
    return reasons;
  }

  private static String join(List<String> reasons) {
    Objects.requireNonNull(reasons, "reasons");
    if (reasons.isEmpty()) {
      throw new IllegalArgumentException("reasons must not be empty");
    }
    return String.join("; ", reasons);
  }
}
