package com.flamingo.ai.deepresearch.service.research.scoring;

import com.flamingo.ai.deepresearch.domain.model.Source;
import java.util.List;

/**
 * Scores how relevant a source is to the active query. One implementation is active per
 * deployment, selected by {@code research.dedup.scoring}, so citation order is reproducible.
 */
public interface RelevanceScorer {

  /** Identifier used in configuration and logs. */
  String name();

  /**
   * Scores one source.
   *
   * @return a value in [0,1]
   */
  double score(String query, Source source);

  /** Scores a batch; the result is index-aligned with {@code sources}. */
  default double[] scoreAll(String query, List<Source> sources) {
    double[] scores = new double[sources.size()];
    for (int i = 0; i < sources.size(); i++) {
      scores[i] = score(query, sources.get(i));
    }
    return scores;
  }
}
