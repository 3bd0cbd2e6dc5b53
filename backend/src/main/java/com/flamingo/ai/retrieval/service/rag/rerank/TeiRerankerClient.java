package com.flamingo.ai.retrieval.service.rag.rerank;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for the Hugging Face TEI (Text Embeddings Inference) {@code /rerank} endpoint serving
 * a cross-encoder. Failures propagate; the caller owns the fallback.
 */
@Component
@Slf4j
public class TeiRerankerClient implements PairwiseRelevanceScorer {

  private final WebClient webClient;
  private final int readTimeoutMs;
  private final boolean rawScores;
  private final boolean truncate;

  @Autowired
  public TeiRerankerClient(RagConfig ragConfig) {
    this(
        WebClient.builder()
            .baseUrl(ragConfig.getReranking().getTei().getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build(),
        ragConfig.getReranking().getTei());
    log.info(
        "TEI reranker client initialized: baseUrl={}, model={}",
        ragConfig.getReranking().getTei().getBaseUrl(),
        ragConfig.getReranking().getTei().getModelId());
  }

  @VisibleForTesting
  TeiRerankerClient(WebClient webClient, RagConfig.Reranking.Tei tei) {
    this.webClient = webClient;
    this.readTimeoutMs = tei.getReadTimeoutMs();
    this.rawScores = tei.isRawScores();
    this.truncate = tei.isTruncate();
  }

  @Override
  @Timed(value = "rag.reranker.tei", description = "Time for TEI cross-encoder scoring")
  @CircuitBreaker(name = "reranker")
  @Retry(name = "reranker")
  public List<Double> scorePairs(String query, List<String> texts, Duration timeout) {
    if (texts.isEmpty()) {
      return List.of();
    }
    var request = new TeiRerankRequest(query, texts, rawScores, truncate);
    List<RerankResult> results =
        webClient
            .post()
            .uri("/rerank")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToFlux(RerankResult.class)
            .collectList()
            .timeout(effectiveTimeout(timeout, readTimeoutMs))
            .block();
    return toInputOrder(results, texts.size());
  }

  /** The caller's deadline, capped by the configured read timeout. */
  static Duration effectiveTimeout(Duration requested, int readTimeoutMs) {
    Duration readTimeout = Duration.ofMillis(readTimeoutMs);
    if (requested == null || requested.compareTo(readTimeout) > 0) {
      return readTimeout;
    }
    return requested;
  }

  /** TEI returns results sorted by score; put them back in request order. */
  static List<Double> toInputOrder(List<RerankResult> results, int expected) {
    if (results == null || results.size() != expected) {
      throw new IllegalStateException(
          "TEI returned "
              + (results == null ? 0 : results.size())
              + " scores for "
              + expected
              + " texts");
    }
    Double[] ordered = new Double[expected];
    for (RerankResult result : results) {
      if (result.index() < 0 || result.index() >= expected || ordered[result.index()] != null) {
        throw new IllegalStateException("TEI returned invalid result index " + result.index());
      }
      ordered[result.index()] = result.score();
    }
    return new ArrayList<>(Arrays.asList(ordered));
  }

  record TeiRerankRequest(String query, List<String> texts, boolean raw_scores, boolean truncate) {}

  /** TEI rerank response element. */
  public record RerankResult(int index, double score) {}
}
