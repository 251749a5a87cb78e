package com.flamingo.ai.deepresearch.service.llm;

/** External provider families whose calls go through {@link ProviderCallExecutor}. */
public enum ProviderKind {
  LLM,
  SEARCH,
  EMBEDDING
}
