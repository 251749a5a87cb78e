package com.flamingo.ai.deepresearch.service.research;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.model.ResearchEvent;
import com.flamingo.ai.deepresearch.domain.model.ResearchOptions;
import com.flamingo.ai.deepresearch.domain.model.ResearchSession;
import com.flamingo.ai.deepresearch.exception.ResearchSessionNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

/**
 * Runs research sessions in the background and keeps them addressable by id. Running sessions
 * are always kept; finished ones are kept up to {@code research.sessions.retain-finished}, oldest
 * evicted first.
 */
@Service
@Slf4j
public class ResearchSessionManager {

  private final ResearchLoopService researchLoopService;
  private final AsyncTaskExecutor researchExecutor;
  private final MeterRegistry meterRegistry;
  private final int retainFinished;

  private final Map<UUID, ResearchSession> sessions = new ConcurrentHashMap<>();
  private final Queue<UUID> finishedOrder = new ConcurrentLinkedQueue<>();
  private final AtomicInteger running = new AtomicInteger();

  public ResearchSessionManager(
      ResearchLoopService researchLoopService,
      @Qualifier("researchExecutor") AsyncTaskExecutor researchExecutor,
      ResearchConfig researchConfig,
      MeterRegistry meterRegistry) {
    this.researchLoopService = researchLoopService;
    this.researchExecutor = researchExecutor;
    this.meterRegistry = meterRegistry;
    this.retainFinished = Math.max(1, researchConfig.getSessions().getRetainFinished());
    meterRegistry.gauge("research.sessions.running", running);
  }

  /**
   * Validates and starts a session in the background.
   *
   * @return the new session, still running
   * @throws TaskRejectedException if the executor is saturated
   */
  public ResearchSession startAsync(String topic, ResearchOptions options) {
    ResearchSession session = researchLoopService.start(topic, options);
    launch(session, options, ResearchProgressListener.NOOP, () -> {});
    return session;
  }

  /**
   * Validates and creates a session; it starts running when the returned stream is subscribed.
   * The stream completes after the session finished. Cancelling the subscription requests
   * cooperative cancellation of the session.
   */
  public ResearchStream startStreaming(String topic, ResearchOptions options) {
    ResearchSession session = researchLoopService.start(topic, options);
    Flux<ResearchEvent> events =
        Flux.create(
            sink -> {
              sink.onCancel(
                  () -> {
                    if (!session.getStatus().isTerminal()) {
                      log.info("Stream of session {} cancelled by client", session.getId());
                      session.requestCancel();
                    }
                  });
              try {
                launch(session, options, sink::next, sink::complete);
              } catch (TaskRejectedException e) {
                sink.error(e);
              }
            },
            FluxSink.OverflowStrategy.BUFFER);
    return new ResearchStream(session, events);
  }

  /**
   * Gets a running or recently finished session.
   *
   * @throws ResearchSessionNotFoundException if the id is unknown or already evicted
   */
  public ResearchSession get(UUID sessionId) {
    ResearchSession session = sessions.get(sessionId);
    if (session == null) {
      throw new ResearchSessionNotFoundException(sessionId);
    }
    return session;
  }

  /**
   * Requests cooperative cancellation; the loop stops before its next iteration and finalizes a
   * degraded report.
   */
  public ResearchSession cancel(UUID sessionId) {
    ResearchSession session = get(sessionId);
    if (!session.getStatus().isTerminal()) {
      log.info("Cancellation requested for research session {}", sessionId);
      session.requestCancel();
    }
    return session;
  }

  public int runningCount() {
    return running.get();
  }

  private void launch(
      ResearchSession session,
      ResearchOptions options,
      ResearchProgressListener listener,
      Runnable onDone) {
    sessions.put(session.getId(), session);
    try {
      researchExecutor.execute(
          () -> {
            running.incrementAndGet();
            try {
              researchLoopService.execute(session, options, listener);
            } finally {
              running.decrementAndGet();
              markFinished(session.getId());
              onDone.run();
            }
          });
    } catch (TaskRejectedException e) {
      sessions.remove(session.getId());
      meterRegistry.counter("research.sessions.rejected").increment();
      log.warn("Research session {} rejected: executor saturated", session.getId());
      throw e;
    }
  }

  private void markFinished(UUID sessionId) {
    finishedOrder.add(sessionId);
    while (finishedOrder.size() > retainFinished) {
      UUID evicted = finishedOrder.poll();
      if (evicted != null) {
        sessions.remove(evicted);
      }
    }
  }

  /** A created session and its progress events. */
  public record ResearchStream(ResearchSession session, Flux<ResearchEvent> events) {}
}
