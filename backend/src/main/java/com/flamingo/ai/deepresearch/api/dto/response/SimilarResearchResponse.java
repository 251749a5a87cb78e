package com.flamingo.ai.deepresearch.api.dto.response;

import com.flamingo.ai.deepresearch.service.history.SimilarResearch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a similarity search hit. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarResearchResponse {

  private HistoryRecordResponse record;

  /** Cosine similarity to the query text, in [-1, 1]. */
  private double similarity;

  public static SimilarResearchResponse from(SimilarResearch similar) {
    return SimilarResearchResponse.builder()
        .record(HistoryRecordResponse.fromEntity(similar.record()))
        .similarity(similar.similarity())
        .build();
  }
}
