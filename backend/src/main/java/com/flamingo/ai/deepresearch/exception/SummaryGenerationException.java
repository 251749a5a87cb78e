package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when the running summary cannot be produced after the retry budget. */
public class SummaryGenerationException extends ProviderException {

  public SummaryGenerationException(String message, ProviderException cause) {
    super(message, cause.getReason(), false, cause);
  }

  @Override
  public String getUserMessage() {
    return "Research findings could not be summarized.";
  }
}
