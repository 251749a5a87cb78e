package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when the web search provider fails or rejects a request. */
public class SearchException extends ProviderException {

  public SearchException(String message) {
    this(message, Reason.UNAVAILABLE, null);
  }

  public SearchException(String message, Throwable cause) {
    this(message, Reason.UNAVAILABLE, cause);
  }

  public SearchException(String message, Reason reason, Throwable cause) {
    this(message, reason, true, cause);
  }

  private SearchException(String message, Reason reason, boolean retryable, Throwable cause) {
    super(message, reason, retryable, cause);
  }

  /** A provider that cannot work at all, e.g. a missing API key. Never retried. */
  public static SearchException misconfigured(String message) {
    return new SearchException(message, Reason.UNAVAILABLE, false, null);
  }

  @Override
  public String getUserMessage() {
    return isRateLimited()
        ? "Web search is rate limited. Please try again in a moment."
        : "Search is temporarily unavailable. Please try again.";
  }
}
