package com.flamingo.ai.deepresearch.domain.model;

import com.flamingo.ai.deepresearch.domain.enums.ResearchPhase;
import com.flamingo.ai.deepresearch.domain.enums.SessionStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one research run. Owned by the loop while it runs; other threads only read snapshots
 * and request cancellation.
 *
 * <p>Invariants: {@code loopCount <= maxLoops}; the status leaves {@code RUNNING} exactly once;
 * sources are unique by fingerprint and by normalized URL, kept in discovery order.
 */
public class ResearchSession {

  private final UUID id;
  private final String topic;
  private final Instant createdAt;
  private final int maxLoops;

  private SessionStatus status = SessionStatus.RUNNING;
  private ResearchPhase phase = ResearchPhase.INITIALIZING;
  private int loopCount;
  private int committedLoops;
  private String runningSummary;
  private String finalReport;
  private boolean degraded;
  private String degradationReason;
  private Instant completedAt;

  private final Map<String, Source> sourcesByFingerprint = new LinkedHashMap<>();
  private final Map<String, Source> sourcesByUrl = new LinkedHashMap<>();
  private final List<ResearchQuery> queries = new ArrayList<>();
  private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

  public ResearchSession(UUID id, String topic, int maxLoops, Instant createdAt) {
    this.id = id;
    this.topic = topic;
    this.maxLoops = maxLoops;
    this.createdAt = createdAt;
  }

  public static ResearchSession create(String topic, int maxLoops) {
    return new ResearchSession(UUID.randomUUID(), topic, maxLoops, Instant.now());
  }

  public UUID getId() {
    return id;
  }

  public String getTopic() {
    return topic;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public int getMaxLoops() {
    return maxLoops;
  }

  public synchronized SessionStatus getStatus() {
    return status;
  }

  public synchronized ResearchPhase getPhase() {
    return phase;
  }

  public synchronized int getLoopCount() {
    return loopCount;
  }

  /** Iterations whose summary reached the session; aborted iterations are not counted. */
  public synchronized int getCommittedLoops() {
    return committedLoops;
  }

  public synchronized String getRunningSummary() {
    return runningSummary;
  }

  public synchronized String getFinalReport() {
    return finalReport;
  }

  public synchronized boolean isDegraded() {
    return degraded;
  }

  public synchronized String getDegradationReason() {
    return degradationReason;
  }

  public synchronized Instant getCompletedAt() {
    return completedAt;
  }

  /** Sources in discovery order. */
  public synchronized List<Source> getSources() {
    return List.copyOf(sourcesByFingerprint.values());
  }

  public synchronized Set<String> getFingerprints() {
    return Collections.unmodifiableSet(new HashSet<>(sourcesByFingerprint.keySet()));
  }

  public synchronized List<ResearchQuery> getQueries() {
    return List.copyOf(queries);
  }

  public synchronized boolean hasReachedLoopBudget() {
    return loopCount >= maxLoops;
  }

  /**
   * Moves the state machine forward.
   *
   * @throws IllegalStateException on a transition the loop does not allow
   */
  public synchronized void transitionTo(ResearchPhase next) {
    if (!phase.canTransitionTo(next)) {
      throw new IllegalStateException("Illegal phase transition " + phase + " -> " + next);
    }
    phase = next;
  }

  public synchronized void recordQuery(ResearchQuery query) {
    queries.add(query);
  }

  /** Looks up an already admitted source by fingerprint or normalized URL. */
  public synchronized Source findExisting(String fingerprint, String normalizedUrl) {
    Source byFingerprint = sourcesByFingerprint.get(fingerprint);
    return byFingerprint != null ? byFingerprint : sourcesByUrl.get(normalizedUrl);
  }

  /**
   * Admits a scored source. A source whose fingerprint or URL is already present is merged into
   * the existing one instead.
   *
   * @return {@code true} if the source was added as new
   */
  public synchronized boolean admitSource(Source source, String normalizedUrl) {
    Source existing = findExisting(source.getFingerprint(), normalizedUrl);
    if (existing != null) {
      existing.mergeFrom(source);
      return false;
    }
    sourcesByFingerprint.put(source.getFingerprint(), source);
    sourcesByUrl.put(normalizedUrl, source);
    return true;
  }

  public synchronized void updateSummary(String summary) {
    runningSummary = summary;
  }

  /** Stores the summary produced by {@code iteration} and counts the iteration as committed. */
  public synchronized void commitSummary(String summary, int iteration) {
    runningSummary = summary;
    committedLoops = Math.max(committedLoops, iteration);
  }

  /** Counts a finished (or aborted) iteration; never moves past the loop budget. */
  public synchronized void completeIteration(int iteration) {
    if (iteration > maxLoops) {
      throw new IllegalStateException(
          "Iteration " + iteration + " exceeds loop budget " + maxLoops);
    }
    loopCount = Math.max(loopCount, iteration);
  }

  public synchronized void markDegraded(String reason) {
    if (!degraded) {
      degraded = true;
      degradationReason = reason;
    }
  }

  public void requestCancel() {
    cancelRequested.set(true);
  }

  public boolean isCancelRequested() {
    return cancelRequested.get();
  }

  /**
   * Stores the report and moves the session to its terminal status.
   *
   * @throws IllegalStateException if the session already finished
   */
  public synchronized void finish(SessionStatus terminalStatus, String report) {
    if (!terminalStatus.isTerminal()) {
      throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
    }
    if (status.isTerminal()) {
      throw new IllegalStateException("Session " + id + " already finished as " + status);
    }
    phase = ResearchPhase.FINALIZING;
    status = terminalStatus;
    finalReport = report;
    completedAt = Instant.now();
  }
}
