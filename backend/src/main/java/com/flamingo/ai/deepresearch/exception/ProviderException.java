package com.flamingo.ai.deepresearch.exception;

/**
 * Base class for failures of an external provider (LLM, web search, embedding). Carries the
 * failure reason and whether a retry may help.
 */
public abstract class ProviderException extends RuntimeException {

  /** Why the provider call failed. */
  public enum Reason {
    UNAVAILABLE,
    TIMEOUT,
    RATE_LIMITED,
    MALFORMED_RESPONSE
  }

  private final Reason reason;
  private final boolean retryable;

  protected ProviderException(String message, Reason reason, boolean retryable, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.retryable = retryable;
  }

  public Reason getReason() {
    return reason;
  }

  public boolean isRetryable() {
    return retryable;
  }

  public boolean isRateLimited() {
    return reason == Reason.RATE_LIMITED;
  }

  /** Message that is safe to show to API clients. */
  public abstract String getUserMessage();
}
