package com.flamingo.ai.deepresearch.api.dto.response;

import com.flamingo.ai.deepresearch.domain.entity.HistoryRecord;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored research session. The embedding itself is not exposed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryRecordResponse {

  private UUID sessionId;
  private String topic;
  private String summary;
  private String finalReport;
  private List<String> sourceUrls;
  private int loopCount;
  private boolean degraded;
  private String embeddingModel;
  private LocalDateTime storedAt;

  public static HistoryRecordResponse fromEntity(HistoryRecord record) {
    return HistoryRecordResponse.builder()
        .sessionId(record.getSessionId())
        .topic(record.getTopic())
        .summary(record.getSummary())
        .finalReport(record.getFinalReport())
        .sourceUrls(record.getSourceUrls())
        .loopCount(record.getLoopCount())
        .degraded(record.isDegraded())
        .embeddingModel(record.getEmbeddingModel())
        .storedAt(record.getStoredAt())
        .build();
  }
}
