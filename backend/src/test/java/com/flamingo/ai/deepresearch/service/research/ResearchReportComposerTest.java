package com.flamingo.ai.deepresearch.service.research;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deepresearch.domain.model.ResearchSession;
import com.flamingo.ai.deepresearch.domain.model.Source;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResearchReportComposerTest {

  private static void admit(ResearchSession session, String url, String title, double score) {
    Source source = Source.builder().url(url).title(title).fingerprint(url).loopIndex(1).build();
    source.refineRelevance(score);
    session.admitSource(source, SourceDeduplicator.normalizeUrl(url));
  }

  @Test
  @DisplayName("should render summary and sources ordered by relevance")
  void shouldRenderSummaryAndRankedSources() {
    ResearchSession session = ResearchSession.create("solar", 2);
    admit(session, "https://low.example", "Low", 0.2);
    admit(session, "https://high.example", "High", 0.9);
    session.updateSummary("Solar panels got cheaper.");
    session.completeIteration(1);

    String report = ResearchReportComposer.compose(session);

    assertThat(report)
        .isEqualTo(
            "## Summary\nSolar panels got cheaper.\n\n### Sources:\n"
                + "1. [High](https://high.example)\n"
                + "2. [Low](https://low.example)");
  }

  @Test
  @DisplayName("should keep discovery order for equal relevance")
  void shouldKeepDiscoveryOrder_whenScoresTie() {
    ResearchSession session = ResearchSession.create("solar", 2);
    admit(session, "https://first.example", "First", 0.5);
    admit(session, "https://second.example", "Second", 0.5);

    assertThat(ResearchReportComposer.citations(session))
        .extracting(Source::getTitle)
        .containsExactly("First", "Second");
  }

  @Test
  @DisplayName("should state that nothing was found when the summary is empty")
  void shouldStateNoFindings_whenSummaryEmpty() {
    ResearchSession session = ResearchSession.create("obscure topic", 1);

    String report = ResearchReportComposer.compose(session);

    assertThat(report).isEqualTo("## Summary\n" + ResearchReportComposer.NO_FINDINGS);
  }

  @Test
  @DisplayName("should mark a degraded report as partial")
  void shouldMarkPartialReport_whenDegraded() {
    ResearchSession session = ResearchSession.create("solar", 3);
    session.commitSummary("Loop one findings.", 1);
    session.completeIteration(1);
    session.completeIteration(2);
    session.markDegraded("search failed in loop 2");

    String report = ResearchReportComposer.compose(session);

    assertThat(report)
        .startsWith("## Summary\nLoop one findings.")
        .contains("**Partial report:** research stopped early (search failed in loop 2)")
        .contains("first 1 iteration.")
        .doesNotContain("first 2 iterations")
        .doesNotContain("### Sources:");
  }

  @Test
  @DisplayName("should say no iteration finished when the first loop was aborted")
  void shouldSayNoIterationFinished_whenFirstLoopAborted() {
    ResearchSession session = ResearchSession.create("solar", 3);
    session.completeIteration(1);
    session.markDegraded("search failed in loop 1");

    String report = ResearchReportComposer.compose(session);

    assertThat(report)
        .contains("research stopped early (search failed in loop 1)")
        .contains("No iteration finished before it stopped.")
        .doesNotContain("first 1 iteration");
  }
}
