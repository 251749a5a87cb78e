package com.flamingo.ai.deepresearch.service.search;

import com.flamingo.ai.deepresearch.exception.ProviderException.Reason;
import com.flamingo.ai.deepresearch.exception.SearchException;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** Maps WebClient failures of search back ends to {@link SearchException}. */
final class SearchErrors {

  private SearchErrors() {}

  static SearchException translate(String provider, Exception e) {
    if (e instanceof SearchException se) {
      return se;
    }
    if (e instanceof WebClientResponseException wce) {
      Reason reason =
          wce.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
              ? Reason.RATE_LIMITED
              : Reason.UNAVAILABLE;
      return new SearchException(
          provider + " returned HTTP " + wce.getStatusCode().value(), reason, e);
    }
    return new SearchException(provider + " request failed: " + e.getMessage(), e);
  }
}
