package com.flamingo.ai.deepresearch.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that critiques the running summary against the topic. Returns the raw JSON text so the
 * caller can validate it and ask for a repair when it is malformed.
 */
public interface ReflectionAgent {

  String SYSTEM_PROMPT =
      """
        You are an expert research assistant analyzing a summary about: {{topic}}

        Tasks:
        1. Decide whether the summary already answers the topic well enough
        2. If it does not, name the single most significant knowledge gap
        3. Propose one self-contained web search query that targets that gap

        Return JSON with exactly these fields:
        - is_sufficient (boolean)
        - knowledge_gap (string) - empty when is_sufficient is true
        - follow_up_query (string) - required when is_sufficient is false
        """;

  @SystemMessage(SYSTEM_PROMPT)
  @UserMessage(
      """
        Reflect on our existing knowledge:
        ===
        {{summary}}
        ===
        Identify a knowledge gap and generate a follow-up web search query. Return JSON.
        """)
  String reflect(@V("topic") String topic, @V("summary") String summary);

  @SystemMessage(SYSTEM_PROMPT)
  @UserMessage(
      """
        Reflect on our existing knowledge:
        ===
        {{summary}}
        ===
        Your previous answer could not be used:
        {{previousOutput}}

        Problem: {{parseError}}

        Answer again with valid JSON containing is_sufficient, knowledge_gap and follow_up_query.
        """)
  String repair(
      @V("topic") String topic,
      @V("summary") String summary,
      @V("previousOutput") String previousOutput,
      @V("parseError") String parseError);
}
