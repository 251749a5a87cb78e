package com.flamingo.ai.deepresearch.exception;

import java.util.UUID;

/** Exception thrown when no history record exists for a session. */
public class HistoryRecordNotFoundException extends RuntimeException {

  private final UUID sessionId;

  public HistoryRecordNotFoundException(UUID sessionId) {
    super("History record not found for session: " + sessionId);
    this.sessionId = sessionId;
  }

  public UUID getSessionId() {
    return sessionId;
  }
}
