package com.flamingo.ai.deepresearch.service.search;

import com.flamingo.ai.deepresearch.domain.enums.SearchApi;
import com.flamingo.ai.deepresearch.exception.SearchException;
import java.util.List;

/** A web search back end. Implementations are stateless and safe for concurrent sessions. */
public interface WebSearchProvider {

  SearchApi api();

  /**
   * Runs one search.
   *
   * @param query search text
   * @param fetchFullPage also return the page text of each hit
   * @param maxResults upper bound of returned hits
   * @return hits in provider ranking order, possibly empty
   * @throws SearchException if the provider is unavailable or rate limited
   */
  List<SearchHit> search(String query, boolean fetchFullPage, int maxResults);
}
