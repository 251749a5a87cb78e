package com.flamingo.ai.deepresearch.api.sse;

import com.flamingo.ai.deepresearch.api.dto.request.StartResearchRequest;
import com.flamingo.ai.deepresearch.api.dto.response.ResearchSessionResponse;
import com.flamingo.ai.deepresearch.api.dto.response.ResearchStreamEvent;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.model.ResearchOptions;
import com.flamingo.ai.deepresearch.domain.model.ResearchSession;
import com.flamingo.ai.deepresearch.service.research.ResearchSessionManager;
import com.flamingo.ai.deepresearch.service.research.ResearchSessionManager.ResearchStream;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** Controller for research sessions with SSE progress streaming. */
@RestController
@RequestMapping("/api/research")
@RequiredArgsConstructor
@Slf4j
public class ResearchController {

  private final ResearchSessionManager sessionManager;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Starts a research session in the background.
   *
   * @param request topic and optional overrides
   * @return 202 with the running session
   */
  @PostMapping
  public ResponseEntity<ResearchSessionResponse> startResearch(
      @Valid @RequestBody StartResearchRequest request) {
    ResearchSession session =
        sessionManager.startAsync(request.getTopic(), optionsFor(request));
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResearchSessionResponse.from(session));
  }

  /**
   * Starts a research session and streams its progress using Server-Sent Events. The stream ends
   * with a {@code report} event carrying the final report.
   *
   * @param request topic and optional overrides
   * @return a Flux of SSE events
   */
  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ResearchStreamEvent> streamResearch(
      @Valid @RequestBody StartResearchRequest request) {

    ResearchStream stream = sessionManager.startStreaming(request.getTopic(), optionsFor(request));
    UUID sessionId = stream.session().getId();
    log.info("Starting research stream for session {}", sessionId);
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);

    return stream
        .events()
        .map(ResearchStreamEvent::progress)
        .concatWith(Mono.fromSupplier(() -> ResearchStreamEvent.report(stream.session())))
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Research stream completed for session {}", sessionId);
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Research stream error for session {}: {}", sessionId, e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Research stream cancelled for session {}", sessionId);
            })
        .onErrorResume(
            e ->
                Flux.just(
                    ResearchStreamEvent.error(
                        sessionId.toString().substring(0, 8),
                        "Research could not be completed. Please try again later.")));
  }

  /** Gets a snapshot of a running or recently finished session. */
  @GetMapping("/{sessionId}")
  public ResponseEntity<ResearchSessionResponse> getSession(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(ResearchSessionResponse.from(sessionManager.get(sessionId)));
  }

  /**
   * Requests cooperative cancellation. The session stops before its next loop and finishes with a
   * partial report.
   *
   * @return 202 with the session snapshot
   */
  @PostMapping("/{sessionId}/cancel")
  public ResponseEntity<ResearchSessionResponse> cancelSession(@PathVariable UUID sessionId) {
    ResearchSession session = sessionManager.cancel(sessionId);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResearchSessionResponse.from(session));
  }

  private ResearchOptions optionsFor(StartResearchRequest request) {
    return request.applyTo(ResearchOptions.defaults(researchConfig));
  }
}
