package com.flamingo.ai.deepresearch.service.research;

import com.flamingo.ai.deepresearch.domain.model.ResearchOptions;
import com.flamingo.ai.deepresearch.domain.model.ResearchSession;

/**
 * Drives the research state machine: query, search, deduplicate, summarize, reflect, then continue
 * or finalize.
 */
public interface ResearchLoopService {

  /**
   * Validates the request and creates a session in the {@code QUERYING} phase.
   *
   * @throws IllegalArgumentException if the topic is blank
   * @throws com.flamingo.ai.deepresearch.exception.ResearchConfigurationException if the options
   *     are out of bounds
   */
  ResearchSession start(String topic, ResearchOptions options);

  /**
   * Runs the loop until reflection reports sufficiency, the loop budget is used up, an iteration
   * fails or cancellation is requested, then finalizes the report. Blocks the calling thread.
   *
   * <p>Iteration failures end the session as completed with a degraded report. Only unexpected
   * errors end it as failed.
   *
   * @return the same session, now terminal
   */
  ResearchSession execute(
      ResearchSession session, ResearchOptions options, ResearchProgressListener listener);
}
