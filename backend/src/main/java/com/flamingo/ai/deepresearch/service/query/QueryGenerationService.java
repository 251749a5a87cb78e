package com.flamingo.ai.deepresearch.service.query;

import com.flamingo.ai.deepresearch.domain.model.ResearchQuery;

/** Produces the search query of the first loop iteration. */
public interface QueryGenerationService {

  /**
   * Returns an LLM-refined query for {@code topic}, or the topic verbatim when generation is
   * disabled or fails. Never throws for provider failures.
   */
  ResearchQuery initialQuery(String topic);
}
