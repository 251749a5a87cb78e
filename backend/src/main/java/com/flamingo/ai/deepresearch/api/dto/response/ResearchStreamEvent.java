package com.flamingo.ai.deepresearch.api.dto.response;

import com.flamingo.ai.deepresearch.domain.enums.ResearchPhase;
import com.flamingo.ai.deepresearch.domain.enums.SessionStatus;
import com.flamingo.ai.deepresearch.domain.model.ResearchEvent;
import com.flamingo.ai.deepresearch.domain.model.ResearchSession;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for SSE research events. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchStreamEvent {

  /** Event type: progress, report, error. */
  private String eventType;

  /** Event data (JSON object). */
  private Object data;

  /** Creates a progress event. */
  public static ResearchStreamEvent progress(ResearchEvent event) {
    return ResearchStreamEvent.builder()
        .eventType("progress")
        .data(
            new ProgressData(
                event.sessionId(),
                event.phase(),
                event.status(),
                event.loopIndex(),
                event.maxLoops(),
                event.progress(),
                event.message(),
                event.details()))
        .build();
  }

  /** Creates the closing report event of a finished session. */
  public static ResearchStreamEvent report(ResearchSession session) {
    return ResearchStreamEvent.builder()
        .eventType("report")
        .data(
            new ReportData(
                session.getId(),
                session.getStatus(),
                session.getLoopCount(),
                session.isDegraded(),
                session.getDegradationReason(),
                session.getSources().size(),
                session.getFinalReport()))
        .build();
  }

  /** Creates an error event. */
  public static ResearchStreamEvent error(String errorId, String message) {
    return ResearchStreamEvent.builder()
        .eventType("error")
        .data(new ErrorData(errorId, message))
        .build();
  }

  /** Progress event data. */
  @Data
  @AllArgsConstructor
  public static class ProgressData {
    private UUID sessionId;
    private ResearchPhase phase;
    private SessionStatus status;
    private int loopIndex;
    private int maxLoops;

    /** Percentage, 0-100. */
    private double progress;

    private String message;
    private Map<String, Object> details;
  }

  /** Report event data. */
  @Data
  @AllArgsConstructor
  public static class ReportData {
    private UUID sessionId;
    private SessionStatus status;
    private int loopCount;
    private boolean degraded;
    private String degradationReason;
    private int sourceCount;
    private String report;
  }

  /** Error event data. */
  @Data
  @AllArgsConstructor
  public static class ErrorData {
    private String errorId;
    private String message;
  }
}
