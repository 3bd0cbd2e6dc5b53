package com.flamingo.ai.retrieval.exception;

/**
 * Fatal misconfiguration detected at startup or while serving a request, such as a missing model
 * or an embedding dimension that does not match the index. Never degraded silently.
 */
public class RetrievalConfigurationException extends RuntimeException {

  public RetrievalConfigurationException(String message) {
    super(message);
  }

  public RetrievalConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
