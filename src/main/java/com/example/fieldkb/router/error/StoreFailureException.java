package com.example.fieldkb.router.error;

/** Raised when the gap store cannot be reached. A synthetic record replaces the stored one. */
public class StoreFailureException extends RuntimeException {

  public StoreFailureException(String message) {
    super(message);
  }

  public StoreFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
