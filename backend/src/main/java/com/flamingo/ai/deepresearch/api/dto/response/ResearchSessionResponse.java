package com.flamingo.ai.deepresearch.api.dto.response;

import com.flamingo.ai.deepresearch.domain.enums.ResearchPhase;
import com.flamingo.ai.deepresearch.domain.enums.SessionStatus;
import com.flamingo.ai.deepresearch.domain.model.ResearchQuery;
import com.flamingo.ai.deepresearch.domain.model.ResearchSession;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a snapshot of a research session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchSessionResponse {

  private UUID id;
  private String topic;
  private SessionStatus status;
  private ResearchPhase phase;
  private int loopCount;
  private int maxLoops;
  private boolean degraded;
  private String degradationReason;
  private List<String> queries;
  private List<SourceResponse> sources;
  private String runningSummary;

  /** Markdown report; {@code null} while the session runs. */
  private String finalReport;

  private Instant createdAt;
  private Instant completedAt;

  public static ResearchSessionResponse from(ResearchSession session) {
    return ResearchSessionResponse.builder()
        .id(session.getId())
        .topic(session.getTopic())
        .status(session.getStatus())
        .phase(session.getPhase())
        .loopCount(session.getLoopCount())
        .maxLoops(session.getMaxLoops())
        .degraded(session.isDegraded())
        .degradationReason(session.getDegradationReason())
        .queries(session.getQueries().stream().map(ResearchQuery::text).toList())
        .sources(session.getSources().stream().map(SourceResponse::from).toList())
        .runningSummary(session.getRunningSummary())
        .finalReport(session.getFinalReport())
        .createdAt(session.getCreatedAt())
        .completedAt(session.getCompletedAt())
        .build();
  }
}
