package com.flamingo.ai.deepresearch.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/**
 * A retrieved web document. Created by retrieval, scored by the deduplicator; afterwards only the
 * relevance score and the discovery metadata may change.
 */
@Getter
@Builder(toBuilder = true)
public class Source {

  private final String url;
  private final String title;
  private final String snippet;

  /** Full page text when it was fetched, otherwise {@code null}. */
  private final String rawContent;

  private final Instant fetchedAt;

  /** Content hash over the normalized URL and the leading content; set by the deduplicator. */
  private final String fingerprint;

  /** Loop iteration that first discovered this source. */
  private final int loopIndex;

  /** Relevance to the query that was active when the source was last considered, in [0,1]. */
  private volatile double relevanceScore;

  /** Queries that returned this source, in discovery order. */
  @Builder.Default private final Set<String> discoveredBy = new LinkedHashSet<>();

  /** Text used for fingerprinting and scoring: page text when present, otherwise the snippet. */
  public String getContentForScoring() {
    if (rawContent != null && !rawContent.isBlank()) {
      return rawContent;
    }
    return snippet != null ? snippet : "";
  }

  public synchronized Set<String> getDiscoveredBy() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(discoveredBy));
  }

  /** Keeps the higher of the current and the new relevance score. */
  public synchronized void refineRelevance(double score) {
    relevanceScore = Math.max(relevanceScore, score);
  }

  /** Merges discovery metadata of a duplicate into this source. */
  public synchronized void mergeFrom(Source duplicate) {
    refineRelevance(duplicate.getRelevanceScore());
    discoveredBy.addAll(duplicate.getDiscoveredBy());
  }
}
