package com.flamingo.ai.deepresearch.service.search;

import com.flamingo.ai.deepresearch.domain.enums.SearchApi;
import com.flamingo.ai.deepresearch.domain.model.ResearchOptions;
import com.flamingo.ai.deepresearch.domain.model.ResearchQuery;
import com.flamingo.ai.deepresearch.domain.model.Source;
import com.flamingo.ai.deepresearch.exception.ResearchConfigurationException;
import com.flamingo.ai.deepresearch.exception.SearchException;
import com.flamingo.ai.deepresearch.service.llm.ProviderCallExecutor;
import com.flamingo.ai.deepresearch.service.llm.ProviderKind;
import io.micrometer.core.annotation.Timed;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a research query to the session's search back end and turns the hits into unscored
 * {@link Source}s.
 */
@Service
@Slf4j
public class SearchProviderRouter {

  private final Map<SearchApi, WebSearchProvider> providers = new EnumMap<>(SearchApi.class);
  private final ProviderCallExecutor providerCallExecutor;

  public SearchProviderRouter(
      List<WebSearchProvider> providers, ProviderCallExecutor providerCallExecutor) {
    this.providerCallExecutor = providerCallExecutor;
    for (WebSearchProvider provider : providers) {
      this.providers.put(provider.api(), provider);
    }
    log.info("Registered search providers: {}", this.providers.keySet());
  }

  /**
   * Searches with the provider chosen in {@code options}; retried once on transient failures.
   *
   * @throws SearchException when the provider still fails after the retry
   * @throws ResearchConfigurationException when no provider is registered for the search API
   */
  @Timed(value = "research.search", description = "Time taken by web search")
  public List<Source> search(ResearchQuery query, ResearchOptions options) {
    WebSearchProvider provider = providers.get(options.searchApi());
    if (provider == null) {
      throw new ResearchConfigurationException(
          "No search provider registered for " + options.searchApi());
    }
    List<SearchHit> hits =
        providerCallExecutor.call(
            "search",
            ProviderKind.SEARCH,
            () ->
                provider.search(
                    query.text(), options.fetchFullPage(), options.resultsPerQuery()));

    Instant fetchedAt = Instant.now();
    List<Source> sources =
        hits.stream()
            .filter(hit -> hit.url() != null && !hit.url().isBlank())
            .map(hit -> toSource(hit, query, options, fetchedAt))
            .toList();
    log.debug(
        "Search '{}' via {} returned {} sources",
        query.text(),
        options.searchApi(),
        sources.size());
    return sources;
  }

  private static Source toSource(
      SearchHit hit, ResearchQuery query, ResearchOptions options, Instant fetchedAt) {
    Set<String> discoveredBy = new LinkedHashSet<>();
    discoveredBy.add(query.text());
    return Source.builder()
        .url(hit.url().trim())
        .title(hit.title() == null || hit.title().isBlank() ? hit.url() : hit.title().trim())
        .snippet(hit.snippet() == null ? "" : hit.snippet().trim())
        .rawContent(truncate(hit.content(), options.maxCharsPerSource()))
        .fetchedAt(fetchedAt)
        .loopIndex(query.loopIndex())
        .discoveredBy(discoveredBy)
        .build();
  }

  private static String truncate(String content, int maxChars) {
    if (content == null || content.isBlank()) {
      return null;
    }
    return content.length() > maxChars ? content.substring(0, maxChars) : content;
  }
}
