package com.flamingo.ai.retrieval.service.rag.embedding;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.exception.EmbeddingDimensionMismatchException;
import com.flamingo.ai.retrieval.exception.RetrievalConfigurationException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds queries with the configured model.
 *
 * <p>Transient failures yield an empty vector, which callers treat as "semantic signal
 * unavailable". A vector of the wrong dimension is a configuration error and is always rethrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // Embedding models cap input length; queries are short, this only guards pathological input.
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.embedding.query", description = "Time to embed a query")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedQueryFallback")
  @Retry(name = "embedding")
  public float[] embedQuery(String text) {
    if (text.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Query too long for embedding, truncating from {} chars to {} chars",
          text.length(),
          MAX_CHARS_PER_EMBEDDING);
      text = text.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    Response<Embedding> response = embeddingModel.embed(text);
    float[] vector = response.content().vector();

    int expected = ragConfig.getEmbedding().getDimension();
    if (vector.length != expected) {
      throw new EmbeddingDimensionMismatchException("embedding model", expected, vector.length);
    }
    log.debug("Generated query embedding, dimension {}", vector.length);
    return vector;
  }

  @SuppressWarnings("unused")
  private float[] embedQueryFallback(String text, Throwable t) {
    if (t instanceof RetrievalConfigurationException configurationError) {
      throw configurationError;
    }
    log.error("Query embedding failed, continuing without semantic signal: {}", t.getMessage());
    meterRegistry.counter("rag.embedding.failure").increment();
    return new float[0];
  }
}
