package com.flamingo.ai.deepresearch.service.summary;

import com.flamingo.ai.deepresearch.agent.ResearchSummaryAgent;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.model.Source;
import com.flamingo.ai.deepresearch.exception.LlmServiceException;
import com.flamingo.ai.deepresearch.exception.ProviderException;
import com.flamingo.ai.deepresearch.exception.ProviderException.Reason;
import com.flamingo.ai.deepresearch.exception.SummaryGenerationException;
import com.flamingo.ai.deepresearch.service.llm.LlmOutputSanitizer;
import com.flamingo.ai.deepresearch.service.llm.ProviderCallExecutor;
import com.flamingo.ai.deepresearch.service.llm.ProviderKind;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link SummaryService} using the research summary agent. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SummaryServiceImpl implements SummaryService {

  private final ResearchSummaryAgent summaryAgent;
  private final ProviderCallExecutor providerCallExecutor;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "research.summarize", description = "Time to create or extend the summary")
  public String summarize(
      String existingSummary, List<Source> sources, String topic, int maxCharsPerSource) {
    boolean hasExisting = existingSummary != null && !existingSummary.isBlank();
    if (sources == null || sources.isEmpty()) {
      log.debug("No new sources for '{}', keeping the current summary", topic);
      return hasExisting ? existingSummary : "";
    }

    String context = SourceContextFormatter.format(sources, maxCharsPerSource);
    try {
      String raw =
          providerCallExecutor.call(
              "summarize",
              ProviderKind.LLM,
              () ->
                  hasExisting
                      ? summaryAgent.extendSummary(topic, existingSummary, context)
                      : summaryAgent.createSummary(topic, context));
      String summary = clean(raw);
      if (summary.isBlank()) {
        throw new LlmServiceException(
            "Summarizer returned an empty summary", Reason.MALFORMED_RESPONSE, null);
      }
      meterRegistry
          .counter("research.summaries", "mode", hasExisting ? "extend" : "create")
          .increment();
      log.debug(
          "Summary {} for '{}' from {} sources: {} chars",
          hasExisting ? "extended" : "created",
          topic,
          sources.size(),
          summary.length());
      return summary;
    } catch (ProviderException e) {
      meterRegistry.counter("research.summaries.failed").increment();
      throw new SummaryGenerationException(
          "Summary generation failed for '" + topic + "': " + e.getMessage(), e);
    }
  }

  private String clean(String raw) {
    if (raw == null) {
      return "";
    }
    return researchConfig.isStripThinkingTokens()
        ? LlmOutputSanitizer.stripThinkingTokens(raw)
        : raw.trim();
  }
}
