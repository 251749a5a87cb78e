package com.flamingo.ai.deepresearch.domain.enums;

/** Lifecycle status of a research session. */
public enum SessionStatus {
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
