package com.flamingo.ai.deepresearch.exception;

import java.util.UUID;

/** Exception thrown when a live or recently finished research session is not found. */
public class ResearchSessionNotFoundException extends RuntimeException {

  private final UUID sessionId;

  public ResearchSessionNotFoundException(UUID sessionId) {
    super("Research session not found: " + sessionId);
    this.sessionId = sessionId;
  }

  public UUID getSessionId() {
    return sessionId;
  }
}
