package com.flamingo.ai.deepresearch.api.dto.response;

import com.flamingo.ai.deepresearch.service.history.HistoryStats;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for history store statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryStatsResponse {

  private long recordCount;
  private long degradedCount;
  private String embeddingModel;
  private int embeddingDimension;
  private LocalDateTime lastStoredAt;

  public static HistoryStatsResponse from(HistoryStats stats) {
    return HistoryStatsResponse.builder()
        .recordCount(stats.recordCount())
        .degradedCount(stats.degradedCount())
        .embeddingModel(stats.embeddingModel())
        .embeddingDimension(stats.embeddingDimension())
        .lastStoredAt(stats.lastStoredAt())
        .build();
  }
}
