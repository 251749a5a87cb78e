package com.flamingo.ai.deepresearch.config;

import com.flamingo.ai.deepresearch.agent.QueryWriterAgent;
import com.flamingo.ai.deepresearch.agent.ReflectionAgent;
import com.flamingo.ai.deepresearch.agent.ResearchSummaryAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the research agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Query writer agent for the first search query. Uses the JSON-mode chatModel. */
  @Bean
  public QueryWriterAgent queryWriterAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(QueryWriterAgent.class).chatModel(chatModel).build();
  }

  /**
   * Reflection agent for gap analysis. Uses the JSON-mode chatModel; its output is validated by
   * ReflectionService.
   */
  @Bean
  public ReflectionAgent reflectionAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(ReflectionAgent.class).chatModel(chatModel).build();
  }

  /** Summary agent. Uses textChatModel (no JSON response format) for free-form text output. */
  @Bean
  public ResearchSummaryAgent researchSummaryAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(ResearchSummaryAgent.class).chatModel(textChatModel).build();
  }
}
