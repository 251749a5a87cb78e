package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when the research history store fails. */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
