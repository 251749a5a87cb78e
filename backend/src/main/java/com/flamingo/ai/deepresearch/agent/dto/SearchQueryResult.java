package com.flamingo.ai.deepresearch.agent.dto;

/**
 * Structured output from QueryWriterAgent. LangChain4j deserializes the LLM JSON response to this
 * record.
 */
public record SearchQueryResult(String query, String rationale) {}
