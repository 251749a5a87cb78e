package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when the embedding provider fails. */
public class EmbeddingException extends ProviderException {

  public EmbeddingException(String message, Throwable cause) {
    this(message, Reason.UNAVAILABLE, cause);
  }

  public EmbeddingException(String message, Reason reason, Throwable cause) {
    super(message, reason, reason != Reason.MALFORMED_RESPONSE, cause);
  }

  @Override
  public String getUserMessage() {
    return "Embedding service is temporarily unavailable. Please try again later.";
  }
}
