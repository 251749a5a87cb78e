package com.flamingo.ai.deepresearch.agent;

import com.flamingo.ai.deepresearch.agent.dto.SearchQueryResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that turns a research topic into the first web search query. */
public interface QueryWriterAgent {

  @SystemMessage(
      """
        Your goal is to generate a targeted web search query.

        Rules:
        1. The query should be specific enough to find recent, authoritative sources
        2. Keep it short, as a person would type it into a search engine
        3. Prefer terms that appear in the topic itself
        4. The current date is {{currentDate}}; include a year only when recency matters

        Return JSON with these fields:
        - query (string) - the search query
        - rationale (string) - brief explanation of why this query serves the topic
        """)
  @UserMessage(
      """
        Research topic:
        {{topic}}

        Generate a query for web search and return JSON with query and rationale fields.
        """)
  SearchQueryResult writeQuery(@V("topic") String topic, @V("currentDate") String currentDate);
}
