package com.flamingo.ai.deepresearch.service.search;

/**
 * One raw result from a web search provider.
 *
 * @param content full page text when it was requested and available, otherwise {@code null}
 */
public record SearchHit(String title, String url, String snippet, String content) {}
