package com.flamingo.ai.deepresearch.service.research;

import com.flamingo.ai.deepresearch.domain.model.ResearchSession;
import com.flamingo.ai.deepresearch.domain.model.Source;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the final markdown report: the running summary, a note when the run was cut short, then
 * the citations ordered by relevance (highest first, ties in discovery order).
 */
public final class ResearchReportComposer {

  static final String NO_FINDINGS = "No findings could be gathered for this topic.";

  private ResearchReportComposer() {}

  public static String compose(ResearchSession session) {
    StringBuilder report = new StringBuilder("## Summary\n");
    String summary = session.getRunningSummary();
    report.append(summary == null || summary.isBlank() ? NO_FINDINGS : summary.trim());

    if (session.isDegraded()) {
      int committed = session.getCommittedLoops();
      report
          .append("\n\n> **Partial report:** research stopped early (")
          .append(session.getDegradationReason())
          .append("). ");
      if (committed == 0) {
        report.append("No iteration finished before it stopped.");
      } else {
        report
            .append("It covers only what was gathered in the first ")
            .append(committed)
            .append(committed == 1 ? " iteration." : " iterations.");
      }
    }

    List<Source> citations = citations(session);
    if (!citations.isEmpty()) {
      report.append("\n\n### Sources:\n");
      for (int i = 0; i < citations.size(); i++) {
        Source source = citations.get(i);
        report
            .append(i + 1)
            .append(". [")
            .append(source.getTitle())
            .append("](")
            .append(source.getUrl())
            .append(")\n");
      }
    }
    return report.toString().trim();
  }

  /** Session sources sorted by descending relevance; the stable sort keeps discovery order. */
  public static List<Source> citations(ResearchSession session) {
    List<Source> sources = new ArrayList<>(session.getSources());
    sources.sort(Comparator.comparingDouble(Source::getRelevanceScore).reversed());
    return sources;
  }
}
