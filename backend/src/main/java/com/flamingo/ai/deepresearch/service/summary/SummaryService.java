package com.flamingo.ai.deepresearch.service.summary;

import com.flamingo.ai.deepresearch.domain.model.Source;
import com.flamingo.ai.deepresearch.exception.SummaryGenerationException;
import java.util.List;

/** Folds new source material into the running research summary. */
public interface SummaryService {

  /**
   * Creates the summary from {@code sources} when {@code existingSummary} is absent, otherwise
   * merges the sources into it without dropping prior content.
   *
   * @param existingSummary the current running summary, may be {@code null} or blank
   * @param sources new, already deduplicated sources
   * @param topic the research topic
   * @param maxCharsPerSource page text handed to the model per source, from the session options
   * @return the new running summary; the existing one unchanged when {@code sources} is empty
   * @throws SummaryGenerationException if the LLM provider fails after its retry budget
   */
  String summarize(
      String existingSummary, List<Source> sources, String topic, int maxCharsPerSource);
}
