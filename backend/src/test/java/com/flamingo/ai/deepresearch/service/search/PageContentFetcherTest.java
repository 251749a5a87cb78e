package com.flamingo.ai.deepresearch.service.search;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class PageContentFetcherTest {

  private static final String PAGE =
      "<html><head><title>Solar</title></head>"
          + "<body><p>Module prices fell sharply in 2024.</p></body></html>";

  private PageContentFetcher fetcher;

  @BeforeEach
  void setUp() {
    ResearchConfig researchConfig = new ResearchConfig();
    researchConfig.getSearch().setPageFetchTimeout(Duration.ofMillis(300));
    WebClient.Builder builder =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  String host = request.url().getHost();
                  if ("slow.example".equals(host)) {
                    return Mono.never();
                  }
                  if ("gone.example".equals(host)) {
                    return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
                  }
                  return Mono.just(
                      ClientResponse.create(HttpStatus.OK)
                          .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_HTML_VALUE)
                          .body(PAGE)
                          .build());
                });
    fetcher = new PageContentFetcher(researchConfig, builder);
  }

  @Test
  @DisplayName("should keep the other pages when one page hangs or has a malformed URL")
  void shouldReturnOtherPages_whenOnePageIsSlowOrMalformed() {
    List<SearchHit> hits =
        List.of(
            new SearchHit("Slow", "https://slow.example/a", "slow snippet", null),
            new SearchHit("Bad", "https://bad.example/{broken}", "bad snippet", null),
            new SearchHit("Solar", "https://solar.example/prices", "solar snippet", null));

    long started = System.nanoTime();
    List<SearchHit> enriched = fetcher.withPageText(hits);
    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

    assertThat(enriched)
        .extracting(SearchHit::url)
        .containsExactly(
            "https://slow.example/a",
            "https://bad.example/{broken}",
            "https://solar.example/prices");
    assertThat(enriched.get(0).content()).isNull();
    assertThat(enriched.get(0).snippet()).isEqualTo("slow snippet");
    assertThat(enriched.get(1).content()).isNull();
    assertThat(enriched.get(2).content()).contains("Module prices fell sharply in 2024.");
    assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
  }

  @Test
  @DisplayName("should return null text for a page answering with an error status")
  void shouldReturnNull_whenPageAnswersWithError() {
    List<String> texts = fetcher.fetchTexts(List.of("https://gone.example/x"));

    assertThat(texts).containsExactly((String) null);
  }

  @Test
  @DisplayName("should return nothing for no URLs")
  void shouldReturnEmpty_whenNoUrls() {
    assertThat(fetcher.fetchTexts(List.of())).isEmpty();
  }
}
