package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when the LLM inference provider fails. */
public class LlmServiceException extends ProviderException {

  public LlmServiceException(String message) {
    this(message, Reason.UNAVAILABLE, null);
  }

  public LlmServiceException(String message, Throwable cause) {
    this(message, Reason.UNAVAILABLE, cause);
  }

  public LlmServiceException(String message, Reason reason, Throwable cause) {
    super(message, reason, reason != Reason.MALFORMED_RESPONSE, cause);
  }

  @Override
  public String getUserMessage() {
    return isRateLimited()
        ? "Service is temporarily busy. Please try again in a moment."
        : "AI service is temporarily unavailable. Please try again later.";
  }
}
