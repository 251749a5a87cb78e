package com.flamingo.ai.deepresearch.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.deepresearch.domain.enums.ResearchPhase;
import com.flamingo.ai.deepresearch.domain.enums.SessionStatus;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ResearchSessionTest {

  private static Source source(String url, String fingerprint, double score, String query) {
    Set<String> discoveredBy = new LinkedHashSet<>();
    discoveredBy.add(query);
    Source source =
        Source.builder()
            .url(url)
            .title(url)
            .snippet("snippet")
            .fingerprint(fingerprint)
            .loopIndex(1)
            .discoveredBy(discoveredBy)
            .build();
    source.refineRelevance(score);
    return source;
  }

  @Nested
  @DisplayName("phase transitions")
  class PhaseTransitions {

    @Test
    @DisplayName("should follow the loop order and allow jumping to finalizing")
    void shouldFollowLoopOrder_andAllowFinalizing() {
      ResearchSession session = ResearchSession.create("topic", 2);

      session.transitionTo(ResearchPhase.QUERYING);
      session.transitionTo(ResearchPhase.SEARCHING);
      session.transitionTo(ResearchPhase.DEDUPLICATING);
      session.transitionTo(ResearchPhase.SUMMARIZING);
      session.transitionTo(ResearchPhase.REFLECTING);
      session.transitionTo(ResearchPhase.QUERYING);
      session.transitionTo(ResearchPhase.SEARCHING);
      session.transitionTo(ResearchPhase.FINALIZING);

      assertThat(session.getPhase()).isEqualTo(ResearchPhase.FINALIZING);
    }

    @Test
    @DisplayName("should reject skipping a phase")
    void shouldRejectTransition_whenPhaseSkipped() {
      ResearchSession session = ResearchSession.create("topic", 2);
      session.transitionTo(ResearchPhase.QUERYING);

      assertThatThrownBy(() -> session.transitionTo(ResearchPhase.SUMMARIZING))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("QUERYING -> SUMMARIZING");
    }
  }

  @Nested
  @DisplayName("loop budget")
  class LoopBudget {

    @Test
    @DisplayName("should never count past the loop budget")
    void shouldRejectIteration_whenBudgetExceeded() {
      ResearchSession session = ResearchSession.create("topic", 2);
      session.completeIteration(1);
      session.completeIteration(2);

      assertThat(session.hasReachedLoopBudget()).isTrue();
      assertThatThrownBy(() -> session.completeIteration(3))
          .isInstanceOf(IllegalStateException.class);
      assertThat(session.getLoopCount()).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("sources")
  class Sources {

    @Test
    @DisplayName("should merge a source with a known URL instead of adding it")
    void shouldMergeSource_whenUrlAlreadyKnown() {
      ResearchSession session = ResearchSession.create("topic", 2);
      Source first = source("https://a.example/x", "fp-1", 0.3, "q1");
      Source sameUrl = source("https://a.example/x", "fp-2", 0.8, "q2");

      assertThat(session.admitSource(first, "a.example/x")).isTrue();
      assertThat(session.admitSource(sameUrl, "a.example/x")).isFalse();

      List<Source> sources = session.getSources();
      assertThat(sources).hasSize(1);
      assertThat(sources.get(0).getRelevanceScore()).isEqualTo(0.8);
      assertThat(sources.get(0).getDiscoveredBy()).containsExactly("q1", "q2");
    }

    @Test
    @DisplayName("should keep sources in discovery order")
    void shouldKeepDiscoveryOrder() {
      ResearchSession session = ResearchSession.create("topic", 2);
      session.admitSource(source("https://b.example", "fp-b", 0.1, "q"), "b.example");
      session.admitSource(source("https://a.example", "fp-a", 0.9, "q"), "a.example");

      assertThat(session.getSources())
          .extracting(Source::getUrl)
          .containsExactly("https://b.example", "https://a.example");
      assertThat(session.getFingerprints()).containsExactlyInAnyOrder("fp-a", "fp-b");
    }
  }

  @Nested
  @DisplayName("finish")
  class Finish {

    @Test
    @DisplayName("should leave running exactly once")
    void shouldRejectSecondFinish() {
      ResearchSession session = ResearchSession.create("topic", 1);
      session.finish(SessionStatus.COMPLETED, "report");

      assertThat(session.getStatus()).isEqualTo(SessionStatus.COMPLETED);
      assertThat(session.getCompletedAt()).isNotNull();
      assertThatThrownBy(() -> session.finish(SessionStatus.FAILED, "again"))
          .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should reject a non-terminal status")
    void shouldRejectFinish_whenStatusNotTerminal() {
      ResearchSession session = ResearchSession.create("topic", 1);

      assertThatThrownBy(() -> session.finish(SessionStatus.RUNNING, "report"))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should keep the first degradation reason")
    void shouldKeepFirstDegradationReason() {
      ResearchSession session = ResearchSession.create("topic", 1);
      session.markDegraded("search failed in loop 1");
      session.markDegraded("cancelled");

      assertThat(session.isDegraded()).isTrue();
      assertThat(session.getDegradationReason()).isEqualTo("search failed in loop 1");
    }
  }
}
