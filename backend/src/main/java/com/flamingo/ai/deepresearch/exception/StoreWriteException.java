package com.flamingo.ai.deepresearch.exception;

import java.util.UUID;

/** Exception thrown when a history record cannot be written. */
public class StoreWriteException extends StoreException {

  private final UUID sessionId;

  public StoreWriteException(UUID sessionId, String message) {
    super(message);
    this.sessionId = sessionId;
  }

  public StoreWriteException(UUID sessionId, String message, Throwable cause) {
    super(message, cause);
    this.sessionId = sessionId;
  }

  public UUID getSessionId() {
    return sessionId;
  }
}
