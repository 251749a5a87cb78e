package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when structured LLM output does not match the expected schema. */
public class LlmOutputParseException extends RuntimeException {

  private final String rawOutput;

  public LlmOutputParseException(String message, String rawOutput) {
    super(message);
    this.rawOutput = rawOutput;
  }

  public LlmOutputParseException(String message, String rawOutput, Throwable cause) {
    super(message, cause);
    this.rawOutput = rawOutput;
  }

  public String getRawOutput() {
    return rawOutput;
  }
}
