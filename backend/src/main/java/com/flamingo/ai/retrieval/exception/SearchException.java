package com.flamingo.ai.retrieval.exception;

import lombok.Getter;

/**
 * The chunk store could not be read. Propagated to the caller as a retrieval failure; the pipeline
 * never retries it.
 */
@Getter
public class SearchException extends RuntimeException {

  private static final String USER_MESSAGE =
      "The document index is unavailable right now. Please retry shortly.";

  /** Store operation that failed, {@code null} when not attributable to one. */
  private final String operation;

  private final String indexName;

  public SearchException(String message) {
    super(message);
    this.operation = null;
    this.indexName = null;
  }

  public SearchException(String operation, String indexName, Throwable cause) {
    super(operation + " failed on index '" + indexName + "'", cause);
    this.operation = operation;
    this.indexName = indexName;
  }

  public String getUserMessage() {
    return USER_MESSAGE;
  }
}
