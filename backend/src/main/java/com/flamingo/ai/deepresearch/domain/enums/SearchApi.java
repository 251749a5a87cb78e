package com.flamingo.ai.deepresearch.domain.enums;

import java.util.Locale;

/** Supported web search back ends. */
public enum SearchApi {
  TAVILY,
  DUCKDUCKGO,
  SEARXNG;

  /** Parses a configuration value such as {@code "duckduckgo"} (case-insensitive). */
  public static SearchApi fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Search API must not be blank");
    }
    return SearchApi.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
