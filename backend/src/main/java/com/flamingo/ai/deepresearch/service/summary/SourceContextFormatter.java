package com.flamingo.ai.deepresearch.service.summary;

import com.flamingo.ai.deepresearch.domain.model.Source;
import java.util.List;

/** Renders sources as the numbered context block handed to the summarizer. */
public final class SourceContextFormatter {

  private SourceContextFormatter() {}

  /**
   * Formats each source as a numbered block with title, URL, snippet and, when present, its page
   * text cut to {@code maxCharsPerSource}.
   */
  public static String format(List<Source> sources, int maxCharsPerSource) {
    StringBuilder sb = new StringBuilder("Sources:\n\n");
    for (int i = 0; i < sources.size(); i++) {
      Source source = sources.get(i);
      sb.append("Source ").append(i + 1).append(": ").append(source.getTitle()).append('\n');
      sb.append("===\n");
      sb.append("URL: ").append(source.getUrl()).append('\n');
      sb.append("===\n");
      sb.append("Most relevant content from source: ")
          .append(source.getSnippet() == null ? "" : source.getSnippet())
          .append('\n');
      sb.append("===\n");
      String raw = source.getRawContent();
      if (raw != null && !raw.isBlank()) {
        String content =
            raw.length() > maxCharsPerSource ? raw.substring(0, maxCharsPerSource) : raw;
        sb.append("Full source content limited to ")
            .append(maxCharsPerSource)
            .append(" characters: ")
            .append(content)
            .append("\n\n");
      } else {
        sb.append('\n');
      }
    }
    return sb.toString().trim();
  }
}
