package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when reflection output stays malformed after the repair attempt. */
public class ReflectionParseException extends LlmOutputParseException {

  public ReflectionParseException(String message, String rawOutput, Throwable cause) {
    super(message, rawOutput, cause);
  }
}
