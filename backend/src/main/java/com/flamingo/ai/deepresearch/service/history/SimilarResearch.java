package com.flamingo.ai.deepresearch.service.history;

import com.flamingo.ai.deepresearch.domain.entity.HistoryRecord;

/** A stored research session with its cosine similarity to a query text. */
public record SimilarResearch(HistoryRecord record, double similarity) {}
