package com.flamingo.ai.deepresearch.service.research;

import com.flamingo.ai.deepresearch.domain.enums.ResearchPhase;

/**
 * Estimates overall progress (0-100) from the phase and the loop iteration. Each iteration gets an
 * equal share of the loop range, split by phase weight: query 10%, search 40%, dedup 5%,
 * summarize 25%, reflect 20%. Only a finished session reaches 100.
 */
final class ResearchProgress {

  private static final double LOOP_START = 5.0;
  private static final double LOOP_RANGE = 85.0;
  private static final double FINALIZING = 95.0;

  private ResearchProgress() {}

  static double estimate(ResearchPhase phase, int iteration, int maxLoops, boolean finished) {
    if (finished) {
      return 100.0;
    }
    double offset =
        switch (phase) {
          case INITIALIZING -> -1.0;
          case QUERYING -> 0.0;
          case SEARCHING -> 0.10;
          case DEDUPLICATING -> 0.50;
          case SUMMARIZING -> 0.55;
          case REFLECTING -> 0.80;
          case FINALIZING -> 2.0;
        };
    if (offset < 0) {
      return 0.0;
    }
    if (offset > 1) {
      return FINALIZING;
    }
    int loops = Math.max(1, maxLoops);
    int completed = Math.max(0, Math.min(iteration, loops) - 1);
    double progress = LOOP_START + LOOP_RANGE * (completed + offset) / loops;
    return Math.round(Math.min(progress, FINALIZING) * 10.0) / 10.0;
  }
}
