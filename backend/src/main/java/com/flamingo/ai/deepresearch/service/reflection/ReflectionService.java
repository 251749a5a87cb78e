package com.flamingo.ai.deepresearch.service.reflection;

import com.flamingo.ai.deepresearch.domain.model.ReflectionResult;
import com.flamingo.ai.deepresearch.exception.ProviderException;
import com.flamingo.ai.deepresearch.exception.ReflectionParseException;

/** Judges the running summary against the topic and proposes the next query. */
public interface ReflectionService {

  /**
   * Reflects on {@code summary}. Malformed model output gets one repair attempt.
   *
   * @return a validated result; {@code followUpQuery} is present whenever {@code isSufficient} is
   *     false
   * @throws ReflectionParseException if the repaired output is still malformed
   * @throws ProviderException if the LLM provider fails after its retry budget
   */
  ReflectionResult reflect(String topic, String summary);
}
