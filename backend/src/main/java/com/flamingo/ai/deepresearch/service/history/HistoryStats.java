package com.flamingo.ai.deepresearch.service.history;

import java.time.LocalDateTime;

/** Summary figures of the history store. */
public record HistoryStats(
    long recordCount,
    long degradedCount,
    String embeddingModel,
    int embeddingDimension,
    LocalDateTime lastStoredAt) {}
