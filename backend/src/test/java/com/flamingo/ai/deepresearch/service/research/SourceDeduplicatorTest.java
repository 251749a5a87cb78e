package com.flamingo.ai.deepresearch.service.research;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.model.ResearchSession;
import com.flamingo.ai.deepresearch.domain.model.Source;
import com.flamingo.ai.deepresearch.service.research.SourceDeduplicator.Partition;
import com.flamingo.ai.deepresearch.service.research.scoring.LexicalRelevanceScorer;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SourceDeduplicatorTest {

  private SourceDeduplicator deduplicator;

  @BeforeEach
  void setUp() {
    deduplicator = new SourceDeduplicator(new LexicalRelevanceScorer(), new ResearchConfig());
  }

  private static Source source(String url, String title, String snippet) {
    Set<String> discoveredBy = new LinkedHashSet<>();
    discoveredBy.add("query");
    return Source.builder()
        .url(url)
        .title(title)
        .snippet(snippet)
        .loopIndex(1)
        .discoveredBy(discoveredBy)
        .build();
  }

  @Nested
  @DisplayName("filter")
  class Filter {

    @Test
    @DisplayName("should drop a duplicate within the batch")
    void shouldDropDuplicate_whenRepeatedInBatch() {
      List<Source> batch =
          List.of(
              source("https://a.example/qc", "Quantum computing 2024", "Qubits scaled up"),
              source("https://www.a.example/qc/", "Quantum computing 2024", "Qubits scaled up"),
              source("https://b.example/qc", "Quantum error correction", "Logical qubits"));

      List<Source> kept = deduplicator.filter(batch, Set.of(), "quantum computing 2024");

      assertThat(kept).hasSize(2);
      assertThat(kept).allSatisfy(s -> assertThat(s.getFingerprint()).hasSize(64));
    }

    @Test
    @DisplayName("should drop sources whose fingerprint is already known")
    void shouldDropSource_whenFingerprintKnown() {
      Source known = source("https://a.example", "Title", "Body");
      String fingerprint = deduplicator.fingerprint(known);

      List<Source> kept = deduplicator.filter(List.of(known), Set.of(fingerprint), "title");

      assertThat(kept).isEmpty();
    }

    @Test
    @DisplayName("should return an empty list for empty input")
    void shouldReturnEmpty_whenInputEmpty() {
      assertThat(deduplicator.filter(List.of(), Set.of(), "query")).isEmpty();
    }

    @Test
    @DisplayName("should be idempotent once the kept fingerprints are known")
    void shouldBeIdempotent_whenFingerprintsAdded() {
      List<Source> batch =
          List.of(
              source("https://a.example", "Fusion", "Tokamak"),
              source("https://b.example", "Fission", "Reactor"));
      Set<String> existing = new HashSet<>();

      List<Source> first = deduplicator.filter(batch, existing, "fusion");
      first.forEach(s -> existing.add(s.getFingerprint()));

      assertThat(first).hasSize(2);
      assertThat(deduplicator.filter(batch, existing, "fusion")).isEmpty();
    }

    @Test
    @DisplayName("should sort by relevance, keeping input order on ties")
    void shouldSortByRelevance_stableOnTies() {
      List<Source> batch =
          List.of(
              source("https://1.example", "Cooking pasta", "Boil water"),
              source("https://2.example", "Solar panels efficiency", "Solar panels"),
              source("https://3.example", "Gardening", "Tomatoes"));

      List<Source> kept = deduplicator.filter(batch, Set.of(), "solar panels");

      assertThat(kept)
          .extracting(Source::getUrl)
          .containsExactly("https://2.example", "https://1.example", "https://3.example");
      assertThat(kept.get(0).getRelevanceScore()).isEqualTo(1.0);
      assertThat(kept.get(1).getRelevanceScore()).isZero();
    }

    @Test
    @DisplayName("should not modify the input sources")
    void shouldNotModifyInput() {
      Source input = source("https://a.example", "Solar", "Solar");

      deduplicator.filter(List.of(input), Set.of(), "solar");

      assertThat(input.getFingerprint()).isNull();
      assertThat(input.getRelevanceScore()).isZero();
    }
  }

  @Nested
  @DisplayName("partition")
  class PartitionTests {

    @Test
    @DisplayName("should split fresh sources from ones the session already holds")
    void shouldSplitFreshAndRediscovered() {
      ResearchSession session = ResearchSession.create("solar", 3);
      Source known =
          deduplicator
              .filter(List.of(source("https://a.example", "Solar", "Old text")), Set.of(), "solar")
              .get(0);
      session.admitSource(known, SourceDeduplicator.normalizeUrl(known.getUrl()));

      Partition partition =
          deduplicator.partition(
              List.of(
                  source("https://a.example", "Solar", "Old text"),
                  source("https://a.example/", "Solar", "Page changed since"),
                  source("https://c.example", "Solar cells", "New")),
              session,
              "solar cells");

      assertThat(partition.fresh()).extracting(Source::getUrl).containsExactly("https://c.example");
      assertThat(partition.rediscovered()).hasSize(2);
    }
  }

  @Nested
  @DisplayName("normalizeUrl")
  class NormalizeUrl {

    @Test
    @DisplayName("should drop scheme, www, default port, fragment and trailing slash")
    void shouldNormalizeEquivalentUrls() {
      assertThat(SourceDeduplicator.normalizeUrl("HTTPS://www.Example.com:443/a/b/#top"))
          .isEqualTo("example.com/a/b");
      assertThat(SourceDeduplicator.normalizeUrl("http://example.com/a/b"))
          .isEqualTo("example.com/a/b");
    }

    @Test
    @DisplayName("should keep the query string and non-default ports")
    void shouldKeepQueryAndPort() {
      assertThat(SourceDeduplicator.normalizeUrl("http://example.com:8080/search?q=1"))
          .isEqualTo("example.com:8080/search?q=1");
    }
  }
}
