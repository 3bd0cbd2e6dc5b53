package com.flamingo.ai.retrieval.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Error body returned by every endpoint. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  public static final String NO_RESULTS = "RETRIEVAL_001";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String CONFIGURATION_ERROR = "CONFIG_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Short id also written to the log line for this failure. */
  private final String errorId;

  private final int status;

  private final String code;

  private final String message;

  /** Rephrasing hints; only present on {@link #NO_RESULTS}. */
  private final List<String> suggestions;

  private final String path;

  private final Instant timestamp;
}
