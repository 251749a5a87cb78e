package com.flamingo.ai.deepresearch.service.research;

import com.flamingo.ai.deepresearch.domain.model.ResearchEvent;

/** Receives progress events of one research session, on the session's worker thread. */
@FunctionalInterface
public interface ResearchProgressListener {

  ResearchProgressListener NOOP = event -> {};

  void onEvent(ResearchEvent event);
}
