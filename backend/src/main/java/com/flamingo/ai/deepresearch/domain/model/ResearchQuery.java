package com.flamingo.ai.deepresearch.domain.model;

/**
 * A search query issued by the loop.
 *
 * @param text query text sent to the search provider
 * @param loopIndex iteration that produced the query (1-based)
 * @param rationale why the query was chosen; may be {@code null}
 */
public record ResearchQuery(String text, int loopIndex, String rationale) {}
