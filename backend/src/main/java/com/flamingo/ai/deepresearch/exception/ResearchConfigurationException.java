package com.flamingo.ai.deepresearch.exception;

/** Exception thrown for invalid configuration. Fatal: never retried. */
public class ResearchConfigurationException extends RuntimeException {

  public ResearchConfigurationException(String message) {
    super(message);
  }
}
