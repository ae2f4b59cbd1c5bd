package com.example.fieldkb.router.error;

/** Raised when a research message cannot be handed to the queue. Logged and dropped. */
public class EnqueueFailureException extends RuntimeException {

  public EnqueueFailureException(String message) {
    super(message);
  }

  public EnqueueFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
