package com.flamingo.ai.deepresearch.service.query;

import com.flamingo.ai.deepresearch.agent.QueryWriterAgent;
import com.flamingo.ai.deepresearch.agent.dto.SearchQueryResult;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.model.ResearchQuery;
import com.flamingo.ai.deepresearch.exception.ProviderException;
import com.flamingo.ai.deepresearch.service.llm.LlmOutputSanitizer;
import com.flamingo.ai.deepresearch.service.llm.ProviderCallExecutor;
import com.flamingo.ai.deepresearch.service.llm.ProviderKind;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class QueryGenerationServiceImpl implements QueryGenerationService {

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);
  private static final int MAX_QUERY_CHARS = 400;

  private final QueryWriterAgent queryWriterAgent;
  private final ProviderCallExecutor providerCallExecutor;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Override
  @Timed(value = "research.query_generation", description = "Time to write the first query")
  public ResearchQuery initialQuery(String topic) {
    if (!researchConfig.isGenerateInitialQuery()) {
      return new ResearchQuery(topic, 1, "topic used verbatim");
    }
    String currentDate = LocalDate.now(clock).format(DATE_FORMAT);
    try {
      SearchQueryResult result =
          providerCallExecutor.call(
              "write-query",
              ProviderKind.LLM,
              () -> queryWriterAgent.writeQuery(topic, currentDate));
      String query = validateQuery(result == null ? null : result.query());
      if (query == null) {
        log.warn("Query writer returned no usable query for '{}', using the topic", topic);
        meterRegistry.counter("research.query_generation.fallback").increment();
        return new ResearchQuery(topic, 1, "topic used verbatim");
      }
      log.debug("Initial query for '{}': '{}' ({})", topic, query, result.rationale());
      meterRegistry.counter("research.query_generation.generated").increment();
      return new ResearchQuery(query, 1, result.rationale());
    } catch (ProviderException e) {
      log.warn("Query generation failed for '{}', using the topic: {}", topic, e.getMessage());
      meterRegistry.counter("research.query_generation.fallback").increment();
      return new ResearchQuery(topic, 1, "topic used verbatim");
    }
  }

  private String validateQuery(String query) {
    if (query == null) {
      return null;
    }
    String cleaned = LlmOutputSanitizer.stripThinkingTokens(query).replaceAll("\\s+", " ").trim();
    if (cleaned.isEmpty() || cleaned.length() > MAX_QUERY_CHARS) {
      return null;
    }
    return cleaned;
  }
}
