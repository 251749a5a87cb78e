package com.flamingo.ai.deepresearch.domain.model;

import java.util.Optional;

/**
 * Outcome of reflecting on the running summary. Only the reflection step can set {@code
 * isSufficient}.
 */
public record ReflectionResult(boolean isSufficient, String knowledgeGap, String followUpQuery) {

  public Optional<String> followUp() {
    return Optional.ofNullable(followUpQuery).filter(q -> !q.isBlank());
  }

  public static ReflectionResult sufficient(String note) {
    return new ReflectionResult(true, note == null ? "" : note, null);
  }

  public static ReflectionResult gap(String knowledgeGap, String followUpQuery) {
    return new ReflectionResult(false, knowledgeGap, followUpQuery);
  }
}
