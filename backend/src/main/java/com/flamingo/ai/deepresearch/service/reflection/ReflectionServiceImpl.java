package com.flamingo.ai.deepresearch.service.reflection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deepresearch.agent.ReflectionAgent;
import com.flamingo.ai.deepresearch.domain.model.ReflectionResult;
import com.flamingo.ai.deepresearch.exception.LlmOutputParseException;
import com.flamingo.ai.deepresearch.exception.ReflectionParseException;
import com.flamingo.ai.deepresearch.service.llm.LlmOutputSanitizer;
import com.flamingo.ai.deepresearch.service.llm.ProviderCallExecutor;
import com.flamingo.ai.deepresearch.service.llm.ProviderKind;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of {@link ReflectionService}. The agent returns raw JSON which is validated here
 * against the reflection schema: {@code is_sufficient} must be a boolean and a non-sufficient
 * result must carry a non-blank {@code follow_up_query}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReflectionServiceImpl implements ReflectionService {

  private final ReflectionAgent reflectionAgent;
  private final ProviderCallExecutor providerCallExecutor;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "research.reflect", description = "Time to reflect on the running summary")
  public ReflectionResult reflect(String topic, String summary) {
    String raw =
        providerCallExecutor.call(
            "reflect", ProviderKind.LLM, () -> reflectionAgent.reflect(topic, summary));
    try {
      return record(parse(raw));
    } catch (LlmOutputParseException first) {
      log.warn(
          "Reflection output malformed for '{}', asking for repair: {}", topic, first.getMessage());
      meterRegistry.counter("research.reflection.repairs").increment();

      String repaired =
          providerCallExecutor.call(
              "reflect-repair",
              ProviderKind.LLM,
              () -> reflectionAgent.repair(topic, summary, raw, first.getMessage()));
      try {
        return record(parse(repaired));
      } catch (LlmOutputParseException second) {
        meterRegistry.counter("research.reflection.parse_failures").increment();
        throw new ReflectionParseException(
            "Reflection output still malformed after repair: " + second.getMessage(),
            repaired,
            second);
      }
    }
  }

  /** Parses and validates one model answer. */
  ReflectionResult parse(String raw) {
    String json = LlmOutputSanitizer.cleanJson(raw);
    if (json.isEmpty()) {
      throw new LlmOutputParseException("empty reflection output", raw);
    }
    JsonNode node;
    try {
      node = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new LlmOutputParseException("reflection output is not valid JSON", raw, e);
    }
    if (node == null || !node.isObject()) {
      throw new LlmOutputParseException("reflection output is not a JSON object", raw);
    }

    JsonNode sufficientNode = node.get("is_sufficient");
    if (sufficientNode == null || !sufficientNode.isBoolean()) {
      throw new LlmOutputParseException("'is_sufficient' must be a boolean", raw);
    }
    boolean sufficient = sufficientNode.booleanValue();
    String knowledgeGap = text(node, "knowledge_gap");
    String followUpQuery = text(node, "follow_up_query");

    if (sufficient) {
      return ReflectionResult.sufficient(knowledgeGap);
    }
    if (followUpQuery == null || followUpQuery.isBlank()) {
      throw new LlmOutputParseException(
          "'follow_up_query' is required when 'is_sufficient' is false", raw);
    }
    return ReflectionResult.gap(knowledgeGap == null ? "" : knowledgeGap, followUpQuery.trim());
  }

  private ReflectionResult record(ReflectionResult result) {
    meterRegistry
        .counter("research.reflections", "sufficient", String.valueOf(result.isSufficient()))
        .increment();
    return result;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.isTextual() ? value.textValue() : value.toString();
  }
}
