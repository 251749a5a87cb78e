package com.flamingo.ai.deepresearch.api.dto.response;

import com.flamingo.ai.deepresearch.domain.model.Source;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a source gathered by a session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceResponse {

  private String url;
  private String title;
  private String snippet;
  private double relevanceScore;
  private int loopIndex;
  private List<String> discoveredBy;

  public static SourceResponse from(Source source) {
    return SourceResponse.builder()
        .url(source.getUrl())
        .title(source.getTitle())
        .snippet(source.getSnippet())
        .relevanceScore(source.getRelevanceScore())
        .loopIndex(source.getLoopIndex())
        .discoveredBy(List.copyOf(source.getDiscoveredBy()))
        .build();
  }
}
