package com.flamingo.ai.deepresearch.domain.model;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.enums.SearchApi;
import com.flamingo.ai.deepresearch.exception.ResearchConfigurationException;
import lombok.Builder;

/**
 * Immutable per-session settings, captured when the session starts so concurrent sessions never
 * read shared mutable configuration.
 */
@Builder(toBuilder = true)
public record ResearchOptions(
    int maxLoops,
    SearchApi searchApi,
    boolean fetchFullPage,
    int resultsPerQuery,
    int maxCharsPerSource) {

  public static final int MIN_LOOPS = 1;
  public static final int MAX_LOOPS = 10;

  /** Options taken from the service-wide defaults. */
  public static ResearchOptions defaults(ResearchConfig config) {
    return ResearchOptions.builder()
        .maxLoops(config.getMaxLoops())
        .searchApi(config.getSearchApi())
        .fetchFullPage(config.isFetchFullPage())
        .resultsPerQuery(config.getResultsPerQuery())
        .maxCharsPerSource(config.getMaxCharsPerSource())
        .build();
  }

  /**
   * Checks the bounds.
   *
   * @throws ResearchConfigurationException if any setting is out of range
   */
  public ResearchOptions validate() {
    if (maxLoops < MIN_LOOPS || maxLoops > MAX_LOOPS) {
      throw new ResearchConfigurationException(
          String.format(
              "max_loops must be between %d and %d, was %d", MIN_LOOPS, MAX_LOOPS, maxLoops));
    }
    if (searchApi == null) {
      throw new ResearchConfigurationException("search_api is required");
    }
    if (resultsPerQuery < 1) {
      throw new ResearchConfigurationException("results per query must be positive");
    }
    if (maxCharsPerSource < 1) {
      throw new ResearchConfigurationException("max chars per source must be positive");
    }
    return this;
  }
}
