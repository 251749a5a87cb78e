package com.flamingo.ai.deepresearch.service.embedding;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.EmbeddingException;
import com.flamingo.ai.deepresearch.exception.ProviderException.Reason;
import com.flamingo.ai.deepresearch.exception.ResearchConfigurationException;
import com.flamingo.ai.deepresearch.service.llm.ProviderCallExecutor;
import com.flamingo.ai.deepresearch.service.llm.ProviderKind;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Service for generating text embeddings with the configured embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final ProviderCallExecutor providerCallExecutor;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds {@code text}, truncated to the configured input limit.
   *
   * @return a vector of exactly the configured dimension
   * @throws EmbeddingException if the provider fails after retries
   * @throws ResearchConfigurationException if the model returns a vector of another dimension
   */
  public float[] embed(String text) {
    int maxChars = researchConfig.getEmbedding().getMaxInputChars();
    String input = text == null ? "" : text;
    if (input.length() > maxChars) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          maxChars);
      input = input.substring(0, maxChars);
    }
    String finalInput = input;

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response =
          providerCallExecutor.call(
              "embed", ProviderKind.EMBEDDING, () -> embeddingModel.embed(finalInput));
      if (response == null || response.content() == null) {
        throw new EmbeddingException(
            "Embedding model returned no vector", Reason.MALFORMED_RESPONSE, null);
      }
      float[] vector = response.content().vector();
      int expected = dimension();
      if (vector.length != expected) {
        throw new ResearchConfigurationException(
            String.format(
                "Embedding model returned %d dimensions, store is configured for %d",
                vector.length, expected));
      }
      meterRegistry.counter("embedding.requests.success").increment();
      log.debug("Embedding generated, vector dimension: {}", vector.length);
      return vector;
    } catch (EmbeddingException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw e;
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  public int dimension() {
    return researchConfig.getEmbedding().getDimension();
  }

  public String modelName() {
    return researchConfig.getEmbedding().getModelName();
  }

  /** Cosine similarity of two equally sized vectors; 0 when either vector is all zeros. */
  public static double cosineSimilarity(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector dimensions differ: " + a.length + " vs " + b.length);
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
