package com.flamingo.ai.retrieval.service.rag.rerank;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import com.flamingo.ai.retrieval.service.rag.StageOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Reorders candidates with a pairwise relevance scorer.
 *
 * <p>The scorer runs on the retrieval executor and is bounded by a deadline. If it fails, times out
 * or replies with the wrong number of scores, the first {@code topK} candidates are returned in
 * their incoming order with no partial reranking applied. The scorer receives the same deadline,
 * so a timed-out remote call releases its executor thread instead of waiting for the read timeout.
 */
@Service
@Slf4j
public class RerankingOrchestrator {

  private final PairwiseRelevanceScorer scorer;
  private final Executor executor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public RerankingOrchestrator(
      PairwiseRelevanceScorer scorer,
      @Qualifier("retrievalExecutor") Executor executor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.scorer = scorer;
    this.executor = executor;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  public StageOutcome rerank(String query, List<ScoredChunk> candidates, int topK) {
    return rerank(query, candidates, topK, null);
  }

  /**
   * Scores candidates against the query, records {@code rerankerScore} and {@code originalScore},
   * replaces {@code score} with the reranker score and keeps the best {@code topK}.
   *
   * @param deadline maximum wait for the scorer, {@code null} for the configured default
   */
  public StageOutcome rerank(
      String query, List<ScoredChunk> candidates, int topK, Duration deadline) {
    if (candidates.isEmpty()) {
      return StageOutcome.success(List.of());
    }
    List<ScoredChunk> fallback = candidates.subList(0, Math.min(topK, candidates.size()));
    if (!ragConfig.getReranking().isEnabled()) {
      return degrade(fallback, "reranking disabled");
    }

    long timeoutMs =
        deadline != null ? deadline.toMillis() : ragConfig.getReranking().getTimeoutMs();
    List<String> texts = candidates.stream().map(ScoredChunk::getText).toList();
    log.info("Reranking {} chunks with cross-encoder (keep {})", candidates.size(), topK);
    meterRegistry.counter("rag.rerank.invocations").increment();

    List<Double> scores;
    CompletableFuture<List<Double>> call = null;
    try {
      Duration callTimeout = Duration.ofMillis(timeoutMs);
      call =
          CompletableFuture.supplyAsync(
              () -> scorer.scorePairs(query, texts, callTimeout), executor);
      scores = call.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      call.cancel(true);
      return degrade(fallback, "reranker timed out after " + timeoutMs + "ms");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return degrade(fallback, "interrupted while waiting for reranker");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.error("Error during reranking: {}", cause.getMessage(), cause);
      return degrade(fallback, "reranker failed: " + cause.getMessage());
    } catch (RuntimeException e) {
      log.error("Could not submit reranker call: {}", e.getMessage(), e);
      return degrade(fallback, "reranker failed: " + e.getMessage());
    }

    if (scores == null || scores.size() != candidates.size()) {
      return degrade(
          fallback,
          "reranker returned "
              + (scores == null ? 0 : scores.size())
              + " scores for "
              + candidates.size()
              + " candidates");
    }

    for (int i = 0; i < candidates.size(); i++) {
      ScoredChunk chunk = candidates.get(i);
      double rerankerScore = scores.get(i);
      chunk.setRerankerScore(rerankerScore);
      chunk.setOriginalScore(chunk.getScore());
      chunk.setScore(rerankerScore);
    }
    List<ScoredChunk> reranked = new ArrayList<>(candidates);
    reranked.sort(Comparator.comparingDouble(ScoredChunk::getScore).reversed());
    List<ScoredChunk> kept = reranked.subList(0, Math.min(topK, reranked.size()));

    log.info(
        "Reranking complete: top score={}, returned {} chunks",
        String.format("%.4f", kept.get(0).getRerankerScore()),
        kept.size());
    return StageOutcome.success(kept);
  }

  private StageOutcome degrade(List<ScoredChunk> fallback, String reason) {
    log.warn("Falling back to original ranking for reranking: {}", reason);
    meterRegistry.counter("rag.rerank.fallback").increment();
    return StageOutcome.degraded(fallback, reason);
  }
}
