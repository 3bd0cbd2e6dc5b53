package com.flamingo.ai.retrieval.exception;

import lombok.Getter;

/** Raised by the HTTP layer when a retrieval returned no chunks. */
@Getter
public class NoRelevantResultsException extends RuntimeException {

  private final String query;
  private final String searchMethod;

  public NoRelevantResultsException(String query, String searchMethod) {
    super("No relevant chunks found for query");
    this.query = query;
    this.searchMethod = searchMethod;
  }
}
