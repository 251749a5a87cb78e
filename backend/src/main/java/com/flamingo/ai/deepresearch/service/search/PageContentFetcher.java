package com.flamingo.ai.deepresearch.service.search;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Downloads result pages and extracts their plain text with Apache Tika. Pages are fetched
 * concurrently, each bounded by {@code research.search.page-fetch-timeout}. A page that cannot be
 * fetched yields {@code null}; the search hit keeps its snippet.
 */
@Component
@Slf4j
public class PageContentFetcher {

  private static final int MAX_TEXT_CHARS = 100_000;

  private final WebClient webClient;
  private final Tika tika;
  private final Duration pageTimeout;
  private final int concurrency;

  public PageContentFetcher(ResearchConfig researchConfig, WebClient.Builder webClientBuilder) {
    ResearchConfig.Search search = researchConfig.getSearch();
    this.webClient =
        webClientBuilder
            .defaultHeader(HttpHeaders.USER_AGENT, search.getUserAgent())
            .codecs(
                configurer ->
                    configurer.defaultCodecs().maxInMemorySize(search.getMaxResponseBytes()))
            .build();
    this.tika = new Tika();
    this.tika.setMaxStringLength(MAX_TEXT_CHARS);
    this.pageTimeout = search.getPageFetchTimeout();
    this.concurrency = Math.max(1, search.getPageFetchConcurrency());
  }

  /**
   * Fetches the text of every page.
   *
   * @return one entry per URL in the same order; {@code null} where the page is unreachable, too
   *     slow or has no text
   */
  public List<String> fetchTexts(List<String> urls) {
    if (urls.isEmpty()) {
      return List.of();
    }
    List<Optional<String>> fetched;
    try {
      fetched =
          Flux.fromIterable(urls)
              .flatMapSequential(this::fetchOne, concurrency)
              .collectList()
              .block(pageTimeout.multipliedBy(2));
    } catch (IllegalStateException e) {
      log.warn("Page fetching did not finish in time: {}", e.getMessage());
      fetched = null;
    }
    List<String> texts = new ArrayList<>(urls.size());
    if (fetched == null || fetched.size() != urls.size()) {
      texts.addAll(Collections.nCopies(urls.size(), null));
      return texts;
    }
    fetched.forEach(text -> texts.add(text.orElse(null)));
    return texts;
  }

  /** Copies the hits with the text of their pages filled in where it could be fetched. */
  public List<SearchHit> withPageText(List<SearchHit> hits) {
    List<String> texts = fetchTexts(hits.stream().map(SearchHit::url).toList());
    List<SearchHit> enriched = new ArrayList<>(hits.size());
    for (int i = 0; i < hits.size(); i++) {
      SearchHit hit = hits.get(i);
      enriched.add(new SearchHit(hit.title(), hit.url(), hit.snippet(), texts.get(i)));
    }
    return enriched;
  }

  private Mono<Optional<String>> fetchOne(String url) {
    return Mono.defer(() -> webClient.get().uri(url).retrieve().bodyToMono(byte[].class))
        .timeout(pageTimeout)
        .publishOn(Schedulers.boundedElastic())
        .map(body -> extractText(url, body))
        .onErrorResume(
            e -> {
              log.warn("Could not fetch page {}: {}", url, e.toString());
              return Mono.empty();
            })
        .defaultIfEmpty(Optional.empty());
  }

  private Optional<String> extractText(String url, byte[] body) {
    if (body.length == 0) {
      return Optional.empty();
    }
    try {
      String text = tika.parseToString(new ByteArrayInputStream(body));
      String normalized = text.replace(' ', ' ').replaceAll("[ \\t]+", " ").trim();
      return normalized.isEmpty() ? Optional.empty() : Optional.of(normalized);
    } catch (IOException | TikaException e) {
      log.warn("Could not extract text from {}: {}", url, e.getMessage());
      return Optional.empty();
    }
  }
}
