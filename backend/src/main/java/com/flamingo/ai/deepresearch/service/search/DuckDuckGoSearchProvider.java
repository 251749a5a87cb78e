package com.flamingo.ai.deepresearch.service.search;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.enums.SearchApi;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Search through the DuckDuckGo HTML endpoint; needs no API key. */
@Component
@Slf4j
public class DuckDuckGoSearchProvider implements WebSearchProvider {

  private static final String REDIRECT_PARAM = "uddg=";

  private final WebClient webClient;
  private final PageContentFetcher pageContentFetcher;
  private final Duration timeout;

  public DuckDuckGoSearchProvider(
      ResearchConfig researchConfig,
      WebClient.Builder webClientBuilder,
      PageContentFetcher pageContentFetcher) {
    this.pageContentFetcher = pageContentFetcher;
    this.timeout = researchConfig.getCallTimeout();
    this.webClient =
        webClientBuilder
            .baseUrl(researchConfig.getSearch().getDuckduckgo().getBaseUrl())
            .defaultHeader(HttpHeaders.USER_AGENT, researchConfig.getSearch().getUserAgent())
            .codecs(
                configurer ->
                    configurer
                        .defaultCodecs()
                        .maxInMemorySize(researchConfig.getSearch().getMaxResponseBytes()))
            .build();
  }

  @Override
  public SearchApi api() {
    return SearchApi.DUCKDUCKGO;
  }

  @Override
  public List<SearchHit> search(String query, boolean fetchFullPage, int maxResults) {
    String html;
    try {
      html =
          webClient
              .get()
              .uri(uriBuilder -> uriBuilder.path("/html/").queryParam("q", query).build())
              .retrieve()
              .bodyToMono(String.class)
              .block(timeout);
    } catch (RuntimeException e) {
      throw SearchErrors.translate("DuckDuckGo", e);
    }
    List<SearchHit> hits = parseResults(html, maxResults);
    if (fetchFullPage) {
      hits = pageContentFetcher.withPageText(hits);
    }
    log.debug("DuckDuckGo returned {} results for '{}'", hits.size(), query);
    return hits;
  }

  /** Extracts organic results from the HTML result page, skipping ads. */
  static List<SearchHit> parseResults(String html, int maxResults) {
    List<SearchHit> hits = new ArrayList<>();
    if (html == null || html.isBlank()) {
      return hits;
    }
    Document doc = Jsoup.parse(html);
    for (Element result : doc.select("div.result")) {
      if (hits.size() >= maxResults) {
        break;
      }
      if (result.hasClass("result--ad")) {
        continue;
      }
      Element link = result.selectFirst("a.result__a");
      if (link == null) {
        continue;
      }
      String url = resolveUrl(link.attr("href"));
      if (url == null || url.isBlank()) {
        continue;
      }
      Element snippet = result.selectFirst(".result__snippet");
      hits.add(new SearchHit(link.text(), url, snippet != null ? snippet.text() : "", null));
    }
    return hits;
  }

  /** Unwraps DuckDuckGo redirect links ({@code //duckduckgo.com/l/?uddg=...}). */
  static String resolveUrl(String href) {
    if (href == null) {
      return null;
    }
    int start = href.indexOf(REDIRECT_PARAM);
    if (start < 0) {
      return href.startsWith("//") ? "https:" + href : href;
    }
    int end = href.indexOf('&', start);
    String encoded =
        href.substring(start + REDIRECT_PARAM.length(), end < 0 ? href.length() : end);
    return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
  }
}
