package com.flamingo.ai.deepresearch.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that writes and extends the running research summary.
 *
 * <p>Both operations must only use the supplied context and, when extending, the existing summary.
 */
public interface ResearchSummaryAgent {

  String SYSTEM_PROMPT =
      """
        You are a research assistant writing a summary of web search results on a topic.

        Rules:
        1. Use only information found in the provided context and the existing summary
        2. Do not add facts from your own knowledge
        3. Stay focused on the research topic and leave out unrelated material
        4. Write plain paragraphs; no preamble, no title, no list of references
        5. When extending a summary, merge the new information into it. Keep every point of the
           existing summary unless the new context contradicts it, and then state both views
           and reconcile them explicitly. Never drop or overwrite existing content.
        """;

  @SystemMessage(SYSTEM_PROMPT)
  @UserMessage(
      """
        <Context>
        {{context}}
        </Context>

        Create a summary using the context on this topic:
        <Topic>
        {{topic}}
        </Topic>
        """)
  String createSummary(@V("topic") String topic, @V("context") String context);

  @SystemMessage(SYSTEM_PROMPT)
  @UserMessage(
      """
        <Existing Summary>
        {{existingSummary}}
        </Existing Summary>

        <New Context>
        {{context}}
        </New Context>

        Merge the new context into the existing summary on this topic. Do not overwrite it:
        <Topic>
        {{topic}}
        </Topic>
        """)
  String extendSummary(
      @V("topic") String topic,
      @V("existingSummary") String existingSummary,
      @V("context") String context);
}
