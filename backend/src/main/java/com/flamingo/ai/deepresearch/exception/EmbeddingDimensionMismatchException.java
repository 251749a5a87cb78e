package com.flamingo.ai.deepresearch.exception;

/** Exception thrown when stored vectors do not match the configured embedding dimension. */
public class EmbeddingDimensionMismatchException extends ResearchConfigurationException {

  private final int expectedDimension;
  private final int actualDimension;

  public EmbeddingDimensionMismatchException(int expectedDimension, int actualDimension) {
    super(
        String.format(
            "Embedding dimension mismatch: store is configured for %d but found %d",
            expectedDimension, actualDimension));
    this.expectedDimension = expectedDimension;
    this.actualDimension = actualDimension;
  }

  public int getExpectedDimension() {
    return expectedDimension;
  }

  public int getActualDimension() {
    return actualDimension;
  }
}
