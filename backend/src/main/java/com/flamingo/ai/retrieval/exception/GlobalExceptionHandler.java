package com.flamingo.ai.retrieval.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps retrieval failures to {@link ApiError} bodies. An empty result becomes 404 with rephrasing
 * hints, storage failures 503, configuration errors 500 and bad input 400.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private static final List<String> NO_RESULT_SUGGESTIONS =
      List.of(
          "Try rephrasing your question with different keywords",
          "Make your question more specific",
          "Check if your documents cover this topic",
          "Try hybrid search (use_hybrid=true) for better keyword matching");

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(NoRelevantResultsException.class)
  public ResponseEntity<ApiError> handleNoResults(
      NoRelevantResultsException ex, HttpServletRequest request) {
    ApiError error =
        error(HttpStatus.NOT_FOUND, "no_results", ApiError.NO_RESULTS, request)
            .message("I couldn't find relevant information to answer your question.")
            .suggestions(NO_RESULT_SUGGESTIONS)
            .build();
    log.info("No relevant results [{}] for {} search", error.getErrorId(), ex.getSearchMethod());
    return respond(error);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {
    ApiError error =
        error(HttpStatus.SERVICE_UNAVAILABLE, "search_error", ApiError.SEARCH_FAILED, request)
            .message(ex.getUserMessage())
            .build();
    log.error("Chunk store failure [{}]: {}", error.getErrorId(), ex.getMessage(), ex);
    return respond(error);
  }

  @ExceptionHandler(RetrievalConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(
      RetrievalConfigurationException ex, HttpServletRequest request) {
    ApiError error =
        error(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "configuration_error",
                ApiError.CONFIGURATION_ERROR,
                request)
            .message("The retrieval service is misconfigured: " + ex.getMessage())
            .build();
    log.error("Configuration error [{}]: {}", error.getErrorId(), ex.getMessage(), ex);
    return respond(error);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
            .orElse("Validation failed");
    ApiError error =
        error(HttpStatus.BAD_REQUEST, "validation_error", ApiError.VALIDATION_ERROR, request)
            .message(message)
            .build();
    log.warn("Invalid request [{}]: {}", error.getErrorId(), message);
    return respond(error);
  }

  @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
    String message =
        ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
    ApiError error =
        error(HttpStatus.BAD_REQUEST, "validation_error", ApiError.VALIDATION_ERROR, request)
            .message(message)
            .build();
    log.warn("Bad request [{}]: {}", error.getErrorId(), ex.getMessage());
    return respond(error);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    ApiError error =
        error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", ApiError.INTERNAL_ERROR, request)
            .message("An unexpected error occurred. Please try again later.")
            .build();
    log.error("Unexpected error [{}]: {}", error.getErrorId(), ex.getMessage(), ex);
    return respond(error);
  }

  /** Counts the failure and starts an error body with id, status, code, path and timestamp. */
  private ApiError.ApiErrorBuilder error(
      HttpStatus status, String errorType, String code, HttpServletRequest request) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
    return ApiError.builder()
        .errorId(UUID.randomUUID().toString().substring(0, 8))
        .status(status.value())
        .code(code)
        .path(request.getRequestURI())
        .timestamp(Instant.now());
  }

  private static ResponseEntity<ApiError> respond(ApiError error) {
    return ResponseEntity.status(error.getStatus()).body(error);
  }
}
