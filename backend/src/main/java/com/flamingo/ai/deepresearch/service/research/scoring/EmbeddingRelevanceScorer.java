package com.flamingo.ai.deepresearch.service.research.scoring;

import com.flamingo.ai.deepresearch.domain.model.Source;
import com.flamingo.ai.deepresearch.service.embedding.EmbeddingService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Semantic scorer: cosine similarity of query and source embeddings, mapped to [0,1]. */
@Component
@ConditionalOnProperty(name = "research.dedup.scoring", havingValue = "embedding")
@RequiredArgsConstructor
public class EmbeddingRelevanceScorer implements RelevanceScorer {

  private static final int MAX_SOURCE_CHARS = 2000;

  private final EmbeddingService embeddingService;

  @Override
  public String name() {
    return "embedding";
  }

  @Override
  public double score(String query, Source source) {
    return similarity(embeddingService.embed(query), source);
  }

  @Override
  public double[] scoreAll(String query, List<Source> sources) {
    double[] scores = new double[sources.size()];
    if (sources.isEmpty()) {
      return scores;
    }
    float[] queryVector = embeddingService.embed(query);
    for (int i = 0; i < sources.size(); i++) {
      scores[i] = similarity(queryVector, sources.get(i));
    }
    return scores;
  }

  private double similarity(float[] queryVector, Source source) {
    float[] sourceVector = embeddingService.embed(sourceText(source));
    double cosine = EmbeddingService.cosineSimilarity(queryVector, sourceVector);
    return Math.max(0.0, Math.min(1.0, (cosine + 1.0) / 2.0));
  }

  private static String sourceText(Source source) {
    String text = source.getTitle() + "\n" + source.getContentForScoring();
    return text.length() > MAX_SOURCE_CHARS ? text.substring(0, MAX_SOURCE_CHARS) : text;
  }
}
