package com.flamingo.ai.deepresearch.domain.model;

import com.flamingo.ai.deepresearch.domain.enums.ResearchPhase;
import com.flamingo.ai.deepresearch.domain.enums.SessionStatus;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Progress notification emitted by the research loop. */
public record ResearchEvent(
    UUID sessionId,
    ResearchPhase phase,
    SessionStatus status,
    int loopIndex,
    int maxLoops,
    double progress,
    String message,
    Map<String, Object> details,
    Instant timestamp) {}
