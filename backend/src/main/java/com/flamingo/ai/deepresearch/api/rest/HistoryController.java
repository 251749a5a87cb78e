package com.flamingo.ai.deepresearch.api.rest;

import com.flamingo.ai.deepresearch.api.dto.response.HistoryRecordResponse;
import com.flamingo.ai.deepresearch.api.dto.response.HistoryStatsResponse;
import com.flamingo.ai.deepresearch.api.dto.response.SimilarResearchResponse;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.service.history.ResearchHistoryService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the research history store. */
@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
public class HistoryController {

  private final ResearchHistoryService researchHistoryService;
  private final ResearchConfig researchConfig;

  /** Gets the most recently stored sessions, newest first. */
  @GetMapping
  public ResponseEntity<List<HistoryRecordResponse>> getRecent(
      @RequestParam(required = false) Integer limit) {
    int effectiveLimit = limit != null ? limit : researchConfig.getHistory().getRecentLimit();
    List<HistoryRecordResponse> response =
        researchHistoryService.recent(effectiveLimit).stream()
            .map(HistoryRecordResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(response);
  }

  /** Finds stored sessions similar to a query text. */
  @GetMapping("/similar")
  public ResponseEntity<List<SimilarResearchResponse>> findSimilar(
      @RequestParam String query, @RequestParam(defaultValue = "5") int topK) {
    List<SimilarResearchResponse> response =
        researchHistoryService.querySimilar(query, topK).stream()
            .map(SimilarResearchResponse::from)
            .toList();
    return ResponseEntity.ok(response);
  }

  /** Gets store statistics. */
  @GetMapping("/stats")
  public ResponseEntity<HistoryStatsResponse> getStats() {
    return ResponseEntity.ok(HistoryStatsResponse.from(researchHistoryService.stats()));
  }

  /** Gets a stored session by ID. */
  @GetMapping("/{sessionId}")
  public ResponseEntity<HistoryRecordResponse> getRecord(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(
        HistoryRecordResponse.fromEntity(researchHistoryService.get(sessionId)));
  }
}
