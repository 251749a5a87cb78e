package com.flamingo.ai.deepresearch.service.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.enums.SearchApi;
import com.flamingo.ai.deepresearch.exception.SearchException;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Search through the Tavily JSON API, which can return the page text itself. */
@Component
@Slf4j
public class TavilySearchProvider implements WebSearchProvider {

  private final WebClient webClient;
  private final String apiKey;
  private final Duration timeout;

  public TavilySearchProvider(ResearchConfig researchConfig, WebClient.Builder webClientBuilder) {
    ResearchConfig.Search.Tavily tavily = researchConfig.getSearch().getTavily();
    this.apiKey = tavily.getApiKey();
    this.timeout = researchConfig.getCallTimeout();
    this.webClient =
        webClientBuilder
            .baseUrl(tavily.getBaseUrl())
            .codecs(
                configurer ->
                    configurer
                        .defaultCodecs()
                        .maxInMemorySize(researchConfig.getSearch().getMaxResponseBytes()))
            .build();
  }

  @Override
  public SearchApi api() {
    return SearchApi.TAVILY;
  }

  @Override
  public List<SearchHit> search(String query, boolean fetchFullPage, int maxResults) {
    if (apiKey == null || apiKey.isBlank()) {
      throw SearchException.misconfigured(
          "Tavily API key is required. Set TAVILY_API_KEY environment variable.");
    }
    TavilyResponse response;
    try {
      response =
          webClient
              .post()
              .uri("/search")
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(new TavilyRequest(query, maxResults, fetchFullPage))
              .retrieve()
              .bodyToMono(TavilyResponse.class)
              .block(timeout);
    } catch (RuntimeException e) {
      throw SearchErrors.translate("Tavily", e);
    }
    if (response == null || response.results() == null) {
      return List.of();
    }
    List<SearchHit> hits =
        response.results().stream()
            .filter(r -> r.url() != null && !r.url().isBlank())
            .limit(maxResults)
            .map(
                r ->
                    new SearchHit(
                        r.title(), r.url(), r.content(), fetchFullPage ? r.rawContent() : null))
            .toList();
    log.debug("Tavily returned {} results for '{}'", hits.size(), query);
    return hits;
  }

  record TavilyRequest(
      String query,
      @JsonProperty("max_results") int maxResults,
      @JsonProperty("include_raw_content") boolean includeRawContent) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TavilyResponse(List<TavilyResult> results) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TavilyResult(
      String title, String url, String content, @JsonProperty("raw_content") String rawContent) {}
}
