package com.flamingo.ai.deepresearch.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the research loop. {@code INITIALIZING} is the entry state and {@code FINALIZING} the
 * terminal one; every state may jump to {@code FINALIZING} when an iteration is aborted.
 */
public enum ResearchPhase {
  INITIALIZING,
  QUERYING,
  SEARCHING,
  DEDUPLICATING,
  SUMMARIZING,
  REFLECTING,
  FINALIZING;

  /** Whether the loop may move from this phase to {@code next}. */
  public boolean canTransitionTo(ResearchPhase next) {
    return next == FINALIZING || successors().contains(next);
  }

  private Set<ResearchPhase> successors() {
    return switch (this) {
      case INITIALIZING -> EnumSet.of(QUERYING);
      case QUERYING -> EnumSet.of(SEARCHING);
      case SEARCHING -> EnumSet.of(DEDUPLICATING);
      case DEDUPLICATING -> EnumSet.of(SUMMARIZING);
      case SUMMARIZING -> EnumSet.of(REFLECTING);
      case REFLECTING -> EnumSet.of(QUERYING);
      case FINALIZING -> EnumSet.noneOf(ResearchPhase.class);
    };
  }
}
