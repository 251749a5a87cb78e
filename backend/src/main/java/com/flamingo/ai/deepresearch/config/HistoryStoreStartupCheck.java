package com.flamingo.ai.deepresearch.config;

import com.flamingo.ai.deepresearch.service.history.ResearchHistoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup bean that refuses to start on a history store written with a different embedding
 * dimension than the one configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HistoryStoreStartupCheck implements CommandLineRunner {

  private final ResearchHistoryService researchHistoryService;

  @Override
  public void run(String... args) {
    log.info("Checking history store embedding dimensions...");
    researchHistoryService.verifyEmbeddingDimensions();
    log.info("History store ready: {}", researchHistoryService.stats());
  }
}
