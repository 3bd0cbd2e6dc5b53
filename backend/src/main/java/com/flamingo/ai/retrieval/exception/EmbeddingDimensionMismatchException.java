package com.flamingo.ai.retrieval.exception;

import lombok.Getter;

/** A vector's length differs from the deployment's embedding dimension. */
@Getter
public class EmbeddingDimensionMismatchException extends RetrievalConfigurationException {

  private final int expected;
  private final int actual;

  public EmbeddingDimensionMismatchException(String source, int expected, int actual) {
    super(
        String.format(
            "Embedding dimension mismatch in %s: expected %d but got %d",
            source, expected, actual));
    this.expected = expected;
    this.actual = actual;
  }
}
