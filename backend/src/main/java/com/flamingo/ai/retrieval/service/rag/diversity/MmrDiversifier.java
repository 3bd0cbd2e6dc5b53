package com.flamingo.ai.retrieval.service.rag.diversity;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import com.flamingo.ai.retrieval.service.rag.StageOutcome;
import com.flamingo.ai.retrieval.service.rag.semantic.CosineSimilarity;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Maximal Marginal Relevance selection.
 *
 * <p>Greedily picks {@code topK} candidates maximizing {@code λ·sim(query, c) − (1−λ)·max
 * sim(c, selected)}. Similarities are raw cosine values (not clamped), so redundant candidates can
 * be penalized below zero. A candidate without an embedding uses its prior {@code score} as the
 * relevance term and has similarity {@code 0} to everything else.
 *
 * <p>Candidates only get {@code mmrScore} set once the whole selection succeeded; the active
 * {@code score} is left untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MmrDiversifier {

  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public StageOutcome diversify(List<ScoredChunk> candidates, float[] queryEmbedding, int topK) {
    return diversify(candidates, queryEmbedding, topK, ragConfig.getDiversity().getLambda());
  }

  /**
   * Selects up to {@code topK} candidates. Returns the input unchanged when it has no more than
   * {@code topK} items, and falls back to the first {@code topK} of the input order on any
   * computational error.
   */
  public StageOutcome diversify(
      List<ScoredChunk> candidates, float[] queryEmbedding, int topK, double lambda) {
    if (candidates.size() <= topK) {
      return StageOutcome.success(candidates);
    }
    List<ScoredChunk> fallback = candidates.subList(0, topK);
    if (queryEmbedding == null || queryEmbedding.length == 0) {
      return degrade(fallback, "query embedding unavailable");
    }

    log.info(
        "Applying MMR diversification: {} candidates -> {} diverse results (lambda={})",
        candidates.size(),
        topK,
        lambda);
    try {
      List<Selection> selected = select(candidates, queryEmbedding, topK, lambda);
      List<ScoredChunk> result = new ArrayList<>(selected.size());
      for (Selection selection : selected) {
        selection.chunk().setMmrScore(selection.mmrScore());
        result.add(selection.chunk());
      }
      log.debug("MMR complete: selected {} diverse chunks", result.size());
      return StageOutcome.success(result);
    } catch (RuntimeException e) {
      log.error("Error in MMR diversification: {}", e.getMessage(), e);
      return degrade(fallback, "MMR computation failed: " + e.getMessage());
    }
  }

  private List<Selection> select(
      List<ScoredChunk> candidates, float[] queryEmbedding, int topK, double lambda) {
    int n = candidates.size();
    double[] relevance = new double[n];
    for (int i = 0; i < n; i++) {
      ScoredChunk candidate = candidates.get(i);
      relevance[i] =
          candidate.hasEmbedding()
              ? CosineSimilarity.raw(queryEmbedding, candidate.getEmbedding())
              : candidate.getScore();
    }

    // Max similarity of each candidate to the selected set, updated after every pick.
    double[] redundancy = new double[n];
    boolean[] taken = new boolean[n];
    boolean anySelected = false;
    List<Selection> selected = new ArrayList<>(topK);

    while (selected.size() < topK) {
      int best = -1;
      double bestScore = Double.NEGATIVE_INFINITY;
      for (int i = 0; i < n; i++) {
        if (taken[i]) {
          continue;
        }
        double penalty = anySelected ? redundancy[i] : 0.0;
        double mmr = lambda * relevance[i] - (1 - lambda) * penalty;
        if (Double.isNaN(mmr)) {
          throw new ArithmeticException("MMR score is NaN for chunk " + candidates.get(i).getId());
        }
        if (mmr > bestScore) {
          best = i;
          bestScore = mmr;
        }
      }
      if (best < 0) {
        break;
      }

      taken[best] = true;
      ScoredChunk pick = candidates.get(best);
      selected.add(new Selection(pick, bestScore));

      if (!anySelected) {
        Arrays.fill(redundancy, Double.NEGATIVE_INFINITY);
        anySelected = true;
      }
      for (int i = 0; i < n; i++) {
        if (!taken[i]) {
          redundancy[i] = Math.max(redundancy[i], similarity(candidates.get(i), pick));
        }
      }
    }
    return selected;
  }

  private static double similarity(ScoredChunk a, ScoredChunk b) {
    if (!a.hasEmbedding() || !b.hasEmbedding()) {
      return 0.0;
    }
    return CosineSimilarity.raw(a.getEmbedding(), b.getEmbedding());
  }

  private StageOutcome degrade(List<ScoredChunk> fallback, String reason) {
    log.warn("Falling back to original ranking for MMR: {}", reason);
    meterRegistry.counter("rag.mmr.fallback").increment();
    return StageOutcome.degraded(fallback, reason);
  }

  private record Selection(ScoredChunk chunk, double mmrScore) {}
}
