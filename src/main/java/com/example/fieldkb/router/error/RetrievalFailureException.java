package com.example.fieldkb.router.error;

/** Raised when the knowledge retrieval call fails or times out. Coverage degrades to NONE. */
public class RetrievalFailureException extends RuntimeException {

  public RetrievalFailureException(String message) {
    super(message);
  }

  public RetrievalFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
