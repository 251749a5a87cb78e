package com.flamingo.ai.deepresearch.service.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.enums.SearchApi;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Search through a self-hosted SearXNG instance using its JSON output format. */
@Component
@Slf4j
public class SearxngSearchProvider implements WebSearchProvider {

  private final WebClient webClient;
  private final PageContentFetcher pageContentFetcher;
  private final Duration timeout;

  public SearxngSearchProvider(
      ResearchConfig researchConfig,
      WebClient.Builder webClientBuilder,
      PageContentFetcher pageContentFetcher) {
    this.pageContentFetcher = pageContentFetcher;
    this.timeout = researchConfig.getCallTimeout();
    this.webClient =
        webClientBuilder
            .baseUrl(researchConfig.getSearch().getSearxng().getBaseUrl())
            .codecs(
                configurer ->
                    configurer
                        .defaultCodecs()
                        .maxInMemorySize(researchConfig.getSearch().getMaxResponseBytes()))
            .build();
  }

  @Override
  public SearchApi api() {
    return SearchApi.SEARXNG;
  }

  @Override
  public List<SearchHit> search(String query, boolean fetchFullPage, int maxResults) {
    SearxngResponse response;
    try {
      response =
          webClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path("/search")
                          .queryParam("q", query)
                          .queryParam("format", "json")
                          .build())
              .retrieve()
              .bodyToMono(SearxngResponse.class)
              .block(timeout);
    } catch (RuntimeException e) {
      throw SearchErrors.translate("SearXNG", e);
    }
    if (response == null || response.results() == null) {
      return List.of();
    }
    List<SearchHit> hits =
        response.results().stream()
            .filter(r -> r.url() != null && !r.url().isBlank())
            .limit(maxResults)
            .map(r -> new SearchHit(r.title(), r.url(), r.content(), null))
            .toList();
    if (fetchFullPage) {
      hits = pageContentFetcher.withPageText(hits);
    }
    log.debug("SearXNG returned {} results for '{}'", hits.size(), query);
    return hits;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record SearxngResponse(List<SearxngResult> results) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record SearxngResult(String title, String url, String content) {}
}
