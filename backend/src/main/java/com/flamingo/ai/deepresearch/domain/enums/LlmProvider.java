package com.flamingo.ai.deepresearch.domain.enums;

/** Chat and embedding model back ends. LM Studio is reached through its OpenAI-compatible API. */
public enum LlmProvider {
  OPENAI,
  OLLAMA,
  LMSTUDIO
}
