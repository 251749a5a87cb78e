package com.flamingo.ai.deepresearch.service.llm;

import java.util.regex.Pattern;

/** Cleans raw model output before it is used as text or parsed as JSON. */
public final class LlmOutputSanitizer {

  private static final Pattern THINK_BLOCK =
      Pattern.compile("<think>.*?</think>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
  private static final Pattern UNCLOSED_THINK =
      Pattern.compile("<think>.*\\z", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
  private static final Pattern CODE_FENCE =
      Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

  private LlmOutputSanitizer() {}

  /**
   * Removes {@code <think>...</think>} blocks. An opening tag without a closing one drops the rest
   * of the text.
   */
  public static String stripThinkingTokens(String text) {
    if (text == null) {
      return "";
    }
    String stripped = THINK_BLOCK.matcher(text).replaceAll("");
    stripped = UNCLOSED_THINK.matcher(stripped).replaceAll("");
    return stripped.trim();
  }

  /** Unwraps a single markdown code fence such as {@code ```json ... ```}. */
  public static String stripCodeFences(String text) {
    if (text == null) {
      return "";
    }
    String trimmed = text.trim();
    var matcher = CODE_FENCE.matcher(trimmed);
    return matcher.matches() ? matcher.group(1).trim() : trimmed;
  }

  /** Prepares JSON-mode output for parsing. */
  public static String cleanJson(String text) {
    return stripCodeFences(stripThinkingTokens(text));
  }
}
