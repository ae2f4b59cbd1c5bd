package com.example.fieldkb.router.error;

/** Raised when a specialist handler fails. The caller receives the degraded response text. */
public class HandlerFailureException extends RuntimeException {

  public HandlerFailureException(String message) {
    super(message);
  }

  public HandlerFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
