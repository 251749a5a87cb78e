package com.flamingo.ai.deepresearch.config;

import com.flamingo.ai.deepresearch.domain.enums.LlmProvider;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models. The provider is chosen by {@code research.llm.provider};
 * LM Studio is reached through its OpenAI-compatible endpoint.
 *
 * <p>Model-level retries are disabled: retries and timeouts are applied by ProviderCallExecutor.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LangChain4jConfig {

  private static final String LMSTUDIO_API_KEY = "lm-studio";

  private final ResearchConfig researchConfig;

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:2048}")
  private int maxCompletionTokens;

  /** JSON-mode model for structured output (query writing, reflection). */
  @Bean
  public ChatModel chatModel() {
    return buildChatModel(true);
  }

  /** Free-text model for summaries. */
  @Bean
  public ChatModel textChatModel() {
    return buildChatModel(false);
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    ResearchConfig.Embedding embedding = researchConfig.getEmbedding();
    ResearchConfig.Llm llm = researchConfig.getLlm();
    Duration timeout = researchConfig.getCallTimeout();

    return switch (llm.getProvider()) {
      case OPENAI -> {
        validateApiKey();
        yield OpenAiEmbeddingModel.builder()
            .apiKey(openAiApiKey)
            .modelName(embedding.getModelName())
            .dimensions(embedding.getDimension())
            .timeout(timeout)
            .maxRetries(0)
            .build();
      }
      case OLLAMA ->
          OllamaEmbeddingModel.builder()
              .baseUrl(llm.getOllamaBaseUrl())
              .modelName(embedding.getModelName())
              .timeout(timeout)
              .maxRetries(0)
              .build();
      case LMSTUDIO ->
          OpenAiEmbeddingModel.builder()
              .baseUrl(llm.getLmstudioBaseUrl())
              .apiKey(LMSTUDIO_API_KEY)
              .modelName(embedding.getModelName())
              .timeout(timeout)
              .maxRetries(0)
              .build();
    };
  }

  private ChatModel buildChatModel(boolean jsonMode) {
    ResearchConfig.Llm llm = researchConfig.getLlm();
    LlmProvider provider = llm.getProvider();
    Duration timeout = researchConfig.getCallTimeout();
    log.info("Building {} chat model for provider {}", jsonMode ? "JSON" : "text", provider);

    return switch (provider) {
      case OPENAI -> {
        validateApiKey();
        OpenAiChatModel.OpenAiChatModelBuilder builder =
            OpenAiChatModel.builder()
                .apiKey(openAiApiKey)
                .modelName(chatModelName)
                .maxCompletionTokens(maxCompletionTokens)
                .timeout(timeout)
                .maxRetries(0)
                .logRequests(false)
                .logResponses(false);
        if (jsonMode) {
          builder.responseFormat("json_object");
        }
        yield builder.build();
      }
      case OLLAMA -> {
        OllamaChatModel.OllamaChatModelBuilder builder =
            OllamaChatModel.builder()
                .baseUrl(llm.getOllamaBaseUrl())
                .modelName(llm.getModelName())
                .temperature(0.0)
                .timeout(timeout)
                .maxRetries(0);
        if (jsonMode) {
          builder.responseFormat(ResponseFormat.JSON);
        }
        yield builder.build();
      }
      case LMSTUDIO -> {
        OpenAiChatModel.OpenAiChatModelBuilder builder =
            OpenAiChatModel.builder()
                .baseUrl(llm.getLmstudioBaseUrl())
                .apiKey(LMSTUDIO_API_KEY)
                .modelName(llm.getModelName())
                .temperature(0.0)
                .timeout(timeout)
                .maxRetries(0);
        if (jsonMode) {
          builder.responseFormat("json_object");
        }
        yield builder.build();
      }
    };
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
