package com.flamingo.ai.deepresearch.service.research;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.model.ResearchSession;
import com.flamingo.ai.deepresearch.domain.model.Source;
import com.flamingo.ai.deepresearch.service.research.scoring.RelevanceScorer;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fingerprints, deduplicates and scores retrieved sources.
 *
 * <p>A fingerprint is the SHA-256 of the normalized URL plus the first N characters of the
 * content with whitespace collapsed and case folded. {@link #filter} has no side effects; callers
 * merge the returned sources into their session.
 */
@Component
@Slf4j
public class SourceDeduplicator {

  private static final Comparator<Source> BY_RELEVANCE_DESC =
      Comparator.comparingDouble(Source::getRelevanceScore).reversed();

  private final RelevanceScorer relevanceScorer;
  private final int fingerprintContentChars;

  public SourceDeduplicator(RelevanceScorer relevanceScorer, ResearchConfig researchConfig) {
    this.relevanceScorer = relevanceScorer;
    this.fingerprintContentChars = researchConfig.getDedup().getFingerprintContentChars();
    log.info(
        "Source deduplicator using {} relevance scoring, {} content chars per fingerprint",
        relevanceScorer.name(),
        fingerprintContentChars);
  }

  /**
   * Drops sources whose fingerprint is in {@code existing} or repeats within the batch, then scores
   * the survivors against {@code activeQuery}.
   *
   * @return fingerprinted and scored copies, sorted by descending relevance, stable on ties;
   *     empty (never an error) when the input is empty or entirely known
   */
  public List<Source> filter(List<Source> newSources, Set<String> existing, String activeQuery) {
    if (newSources == null || newSources.isEmpty()) {
      return List.of();
    }
    Map<String, Source> unique = new LinkedHashMap<>();
    for (Source source : newSources) {
      String fingerprint = fingerprint(source);
      if (existing.contains(fingerprint)) {
        continue;
      }
      Source kept = unique.get(fingerprint);
      if (kept == null) {
        unique.put(fingerprint, withFingerprint(source, fingerprint));
      } else {
        kept.mergeFrom(source);
      }
    }
    List<Source> survivors = new ArrayList<>(unique.values());
    applyScores(survivors, activeQuery);
    survivors.sort(BY_RELEVANCE_DESC);
    log.debug(
        "Dedup kept {} of {} sources for query '{}'",
        survivors.size(),
        newSources.size(),
        activeQuery);
    return survivors;
  }

  /**
   * Splits a search result against the session: {@code fresh} sources are new to the session and
   * go to the summarizer; {@code rediscovered} ones match an existing source by fingerprint or URL
   * and only refine its score and discovery metadata when committed.
   */
  public Partition partition(List<Source> newSources, ResearchSession session, String activeQuery) {
    Set<String> existing = session.getFingerprints();
    List<Source> fresh = new ArrayList<>();
    List<Source> rediscovered = new ArrayList<>();

    for (Source source : filter(newSources, existing, activeQuery)) {
      if (session.findExisting(source.getFingerprint(), normalizeUrl(source.getUrl())) != null) {
        rediscovered.add(source);
      } else {
        fresh.add(source);
      }
    }

    List<Source> known = new ArrayList<>();
    for (Source source : newSources) {
      String fingerprint = fingerprint(source);
      if (existing.contains(fingerprint)) {
        known.add(withFingerprint(source, fingerprint));
      }
    }
    applyScores(known, activeQuery);
    rediscovered.addAll(known);

    return new Partition(List.copyOf(fresh), List.copyOf(rediscovered));
  }

  /** Content hash identifying duplicate sources. */
  public String fingerprint(Source source) {
    String content = collapse(source.getContentForScoring());
    if (content.length() > fingerprintContentChars) {
      content = content.substring(0, fingerprintContentChars);
    }
    String material = normalizeUrl(source.getUrl()) + "\n" + content;
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Normalizes a URL for identity checks: scheme and {@code www.} dropped, host lower-cased,
   * default port, fragment and trailing slash removed. Unparseable URLs are only trimmed and
   * lower-cased.
   */
  public static String normalizeUrl(String url) {
    if (url == null) {
      return "";
    }
    String trimmed = url.trim();
    try {
      URI uri = new URI(trimmed);
      String host = uri.getHost();
      if (host == null) {
        return trimmed.toLowerCase(Locale.ROOT);
      }
      host = host.toLowerCase(Locale.ROOT);
      if (host.startsWith("www.")) {
        host = host.substring(4);
      }
      StringBuilder normalized = new StringBuilder(host);
      int port = uri.getPort();
      if (port != -1 && port != 80 && port != 443) {
        normalized.append(':').append(port);
      }
      String path = uri.getRawPath() == null ? "" : uri.getRawPath();
      while (path.endsWith("/")) {
        path = path.substring(0, path.length() - 1);
      }
      normalized.append(path);
      if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
        normalized.append('?').append(uri.getRawQuery());
      }
      return normalized.toString();
    } catch (URISyntaxException e) {
      return trimmed.toLowerCase(Locale.ROOT);
    }
  }

  private void applyScores(List<Source> sources, String activeQuery) {
    if (sources.isEmpty()) {
      return;
    }
    double[] scores = relevanceScorer.scoreAll(activeQuery, sources);
    for (int i = 0; i < sources.size(); i++) {
      sources.get(i).refineRelevance(scores[i]);
    }
  }

  private static Source withFingerprint(Source source, String fingerprint) {
    return source.toBuilder()
        .fingerprint(fingerprint)
        .relevanceScore(0.0)
        .discoveredBy(new LinkedHashSet<>(source.getDiscoveredBy()))
        .build();
  }

  private static String collapse(String text) {
    return text.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
  }

  /** Result of {@link #partition}. */
  public record Partition(List<Source> fresh, List<Source> rediscovered) {}
}
