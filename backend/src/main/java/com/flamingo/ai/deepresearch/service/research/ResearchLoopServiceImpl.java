package com.flamingo.ai.deepresearch.service.research;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.enums.ResearchPhase;
import com.flamingo.ai.deepresearch.domain.enums.SessionStatus;
import com.flamingo.ai.deepresearch.domain.model.ReflectionResult;
import com.flamingo.ai.deepresearch.domain.model.ResearchEvent;
import com.flamingo.ai.deepresearch.domain.model.ResearchOptions;
import com.flamingo.ai.deepresearch.domain.model.ResearchQuery;
import com.flamingo.ai.deepresearch.domain.model.ResearchSession;
import com.flamingo.ai.deepresearch.domain.model.Source;
import com.flamingo.ai.deepresearch.exception.LlmOutputParseException;
import com.flamingo.ai.deepresearch.exception.ProviderException;
import com.flamingo.ai.deepresearch.exception.ResearchConfigurationException;
import com.flamingo.ai.deepresearch.exception.StoreException;
import com.flamingo.ai.deepresearch.service.history.ResearchHistoryService;
import com.flamingo.ai.deepresearch.service.query.QueryGenerationService;
import com.flamingo.ai.deepresearch.service.reflection.ReflectionService;
import com.flamingo.ai.deepresearch.service.research.SourceDeduplicator.Partition;
import com.flamingo.ai.deepresearch.service.search.SearchProviderRouter;
import com.flamingo.ai.deepresearch.service.summary.SummaryService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Implementation of {@link ResearchLoopService}.
 *
 * <p>One iteration: (a) take the next query, (b) search, (c) deduplicate and score, (d) summarize,
 * (e) count the iteration, (f) reflect, (g) stop on sufficiency or when the loop budget is used
 * up. The two stop conditions are checked separately. Sources and summary of an iteration are
 * committed to the session only after its summarization succeeded.
 *
 * <p>A provider or parse failure that survives the retry aborts the running iteration only. The
 * aborted iteration still counts against the budget and the session finalizes as completed with a
 * degraded report built from the earlier iterations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchLoopServiceImpl implements ResearchLoopService {

  private final QueryGenerationService queryGenerationService;
  private final SearchProviderRouter searchProviderRouter;
  private final SourceDeduplicator sourceDeduplicator;
  private final SummaryService summaryService;
  private final ReflectionService reflectionService;
  private final ResearchHistoryService researchHistoryService;
  private final ResearchConfig researchConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public ResearchSession start(String topic, ResearchOptions options) {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("Research topic must not be blank");
    }
    if (options == null) {
      throw new ResearchConfigurationException("Research options are required");
    }
    options.validate();

    ResearchSession session = ResearchSession.create(topic.trim(), options.maxLoops());
    session.transitionTo(ResearchPhase.QUERYING);
    meterRegistry.counter("research.sessions.started").increment();
    log.info(
        "Research session {} created for '{}' (max loops {}, search {})",
        session.getId(),
        session.getTopic(),
        options.maxLoops(),
        options.searchApi());
    return session;
  }

  @Override
  @Timed(value = "research.session", description = "Time to run a research session")
  public ResearchSession execute(
      ResearchSession session, ResearchOptions options, ResearchProgressListener listener) {
    ResearchProgressListener progress = listener != null ? listener : ResearchProgressListener.NOOP;
    SessionStatus terminalStatus = SessionStatus.COMPLETED;

    try {
      ResearchQuery nextQuery = null;
      while (true) {
        if (session.isCancelRequested()) {
          log.info(
              "Research session {} cancelled after {} loops",
              session.getId(),
              session.getLoopCount());
          session.markDegraded("cancelled");
          meterRegistry.counter("research.sessions.cancelled").increment();
          break;
        }
        if (session.hasReachedLoopBudget()) {
          break;
        }

        int iteration = session.getLoopCount() + 1;
        ReflectionResult reflection =
            runIteration(session, options, iteration, nextQuery, progress);
        if (reflection == null) {
          break;
        }
        if (reflection.isSufficient()) {
          log.info(
              "Research session {} sufficient after loop {}/{}",
              session.getId(),
              iteration,
              session.getMaxLoops());
          break;
        }
        if (session.hasReachedLoopBudget()) {
          log.info(
              "Research session {} used its loop budget of {}",
              session.getId(),
              session.getMaxLoops());
          break;
        }
        nextQuery =
            new ResearchQuery(
                reflection.followUpQuery(), iteration + 1, reflection.knowledgeGap());
      }
    } catch (RuntimeException e) {
      log.error(
          "Research session {} failed unexpectedly: {}", session.getId(), e.getMessage(), e);
      session.markDegraded("unexpected error: " + e.getMessage());
      terminalStatus = SessionStatus.FAILED;
    }

    finalizeSession(session, terminalStatus, progress);
    return session;
  }

  /**
   * Runs one iteration.
   *
   * @return the reflection result, or {@code null} when the iteration was aborted
   */
  private ReflectionResult runIteration(
      ResearchSession session,
      ResearchOptions options,
      int iteration,
      ResearchQuery followUp,
      ResearchProgressListener progress) {
    meterRegistry.counter("research.iterations").increment();

    enter(session, ResearchPhase.QUERYING);
    ResearchQuery query =
        followUp != null ? followUp : queryGenerationService.initialQuery(session.getTopic());
    session.recordQuery(query);
    log.debug("Session {} loop {} query: '{}'", session.getId(), iteration, query.text());
    emit(
        session,
        iteration,
        "Loop " + iteration + ": searching for '" + query.text() + "'",
        details("query", query.text(), "rationale", query.rationale()),
        progress);

    enter(session, ResearchPhase.SEARCHING);
    emit(
        session,
        iteration,
        "Searching the web",
        details("searchApi", options.searchApi()),
        progress);
    List<Source> raw;
    try {
      raw = searchProviderRouter.search(query, options);
    } catch (ProviderException e) {
      abortIteration(session, iteration, "search failed in loop " + iteration, e, progress);
      return null;
    }

    enter(session, ResearchPhase.DEDUPLICATING);
    Partition partition;
    try {
      partition = sourceDeduplicator.partition(raw, session, query.text());
    } catch (ProviderException e) {
      abortIteration(session, iteration, "source scoring failed in loop " + iteration, e, progress);
      return null;
    }
    emit(
        session,
        iteration,
        "Found " + partition.fresh().size() + " new sources",
        details(
            "retrieved", raw.size(),
            "new", partition.fresh().size(),
            "rediscovered", partition.rediscovered().size()),
        progress);

    enter(session, ResearchPhase.SUMMARIZING);
    emit(session, iteration, "Summarizing sources", Map.of(), progress);
    String summary;
    try {
      summary =
          summaryService.summarize(
              session.getRunningSummary(),
              partition.fresh(),
              session.getTopic(),
              options.maxCharsPerSource());
    } catch (ProviderException e) {
      abortIteration(session, iteration, "summarization failed in loop " + iteration, e, progress);
      return null;
    }

    commit(session, partition, summary, iteration);

    enter(session, ResearchPhase.REFLECTING);
    emit(
        session,
        iteration,
        "Identifying knowledge gaps",
        details("summaryLength", summary.length(), "sources", session.getSources().size()),
        progress);
    ReflectionResult reflection;
    try {
      reflection = reflectionService.reflect(session.getTopic(), summary);
    } catch (ProviderException | LlmOutputParseException e) {
      abortIteration(session, iteration, "reflection failed in loop " + iteration, e, progress);
      return null;
    }
    emit(
        session,
        iteration,
        reflection.isSufficient() ? "Summary is sufficient" : "Knowledge gap identified",
        details(
            "sufficient", reflection.isSufficient(),
            "knowledgeGap", reflection.knowledgeGap(),
            "followUpQuery", reflection.followUpQuery()),
        progress);
    return reflection;
  }

  private void commit(ResearchSession session, Partition partition, String summary, int iteration) {
    List<Source> toAdmit = new ArrayList<>(partition.fresh());
    toAdmit.addAll(partition.rediscovered());
    int added = 0;
    for (Source source : toAdmit) {
      if (session.admitSource(source, SourceDeduplicator.normalizeUrl(source.getUrl()))) {
        added++;
      }
    }
    session.commitSummary(summary, iteration);
    session.completeIteration(iteration);
    log.debug(
        "Session {} loop {} committed: {} new sources, summary {} chars",
        session.getId(),
        iteration,
        added,
        summary.length());
  }

  private void abortIteration(
      ResearchSession session,
      int iteration,
      String reason,
      RuntimeException cause,
      ResearchProgressListener progress) {
    log.warn(
        "Research session {} aborted loop {}: {} ({})",
        session.getId(),
        iteration,
        reason,
        cause.getMessage());
    meterRegistry.counter("research.iterations.aborted").increment();
    session.completeIteration(iteration);
    session.markDegraded(reason);
    emit(
        session,
        iteration,
        "Loop " + iteration + " aborted, finishing with partial results",
        details("reason", reason, "error", cause.getMessage()),
        progress);
  }

  private void finalizeSession(
      ResearchSession session, SessionStatus status, ResearchProgressListener progress) {
    session.transitionTo(ResearchPhase.FINALIZING);
    emit(session, session.getLoopCount(), "Composing final report", Map.of(), progress);
    String report = ResearchReportComposer.compose(session);
    session.finish(status, report);

    String outcome =
        status == SessionStatus.FAILED ? "failed" : session.isDegraded() ? "degraded" : "completed";
    meterRegistry.counter("research.sessions.finished", "outcome", outcome).increment();
    log.info(
        "Research session {} finished as {} after {} loops with {} sources{}",
        session.getId(),
        outcome,
        session.getLoopCount(),
        session.getSources().size(),
        session.isDegraded() ? " (" + session.getDegradationReason() + ")" : "");

    try {
      if (status == SessionStatus.COMPLETED && researchConfig.getHistory().isAutoSave()) {
        saveToHistory(session);
      }
    } finally {
      emit(
          session,
          session.getLoopCount(),
          "Research " + outcome,
          details(
              "degraded", session.isDegraded(),
              "sources", session.getSources().size(),
              "reportLength", report.length()),
          progress);
    }
  }

  private void saveToHistory(ResearchSession session) {
    try {
      researchHistoryService.save(session);
    } catch (StoreException
        | ProviderException
        | ResearchConfigurationException
        | DataAccessException
        | TransactionException e) {
      log.warn(
          "Research session {} finished but could not be saved to history: {}",
          session.getId(),
          e.getMessage());
    }
  }

  private static void enter(ResearchSession session, ResearchPhase phase) {
    if (session.getPhase() != phase) {
      session.transitionTo(phase);
    }
  }

  private void emit(
      ResearchSession session,
      int iteration,
      String message,
      Map<String, Object> details,
      ResearchProgressListener progress) {
    SessionStatus status = session.getStatus();
    ResearchPhase phase = session.getPhase();
    ResearchEvent event =
        new ResearchEvent(
            session.getId(),
            phase,
            status,
            iteration,
            session.getMaxLoops(),
            ResearchProgress.estimate(phase, iteration, session.getMaxLoops(), status.isTerminal()),
            message,
            details,
            Instant.now());
    try {
      progress.onEvent(event);
    } catch (RuntimeException e) {
      log.warn("Progress listener failed for session {}: {}", session.getId(), e.getMessage());
    }
  }

  /** Builds a details map from key/value pairs, skipping null values. */
  private static Map<String, Object> details(Object... keyValues) {
    Map<String, Object> details = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      if (keyValues[i + 1] != null) {
        details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
      }
    }
    return details;
  }
}
