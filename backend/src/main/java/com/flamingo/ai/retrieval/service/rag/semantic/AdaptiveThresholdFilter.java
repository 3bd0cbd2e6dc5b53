package com.flamingo.ai.retrieval.service.rag.semantic;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drops low-similarity chunks from a semantic-only batch using a cut-off derived from the top
 * score.
 *
 * <p>Only valid for cosine scores. Fused RRF scores live on a different scale and are never passed
 * through here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdaptiveThresholdFilter {

  private final RagConfig ragConfig;

  /**
   * Chooses the threshold for a batch: strict when the top score is high, lenient when it is low,
   * otherwise {@code baseThreshold}. An empty batch returns {@code baseThreshold}.
   *
   * @param scores similarity scores in descending order
   */
  public double resolveThreshold(List<Double> scores, double baseThreshold) {
    if (scores.isEmpty()) {
      return baseThreshold;
    }
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    double topScore = scores.get(0);

    if (topScore > retrieval.getHighConfidenceScore()) {
      log.debug(
          "High top score ({}) - using stricter threshold: {}",
          topScore,
          retrieval.getStrictThreshold());
      return retrieval.getStrictThreshold();
    }
    if (topScore < retrieval.getLowConfidenceScore()) {
      log.debug(
          "Low top score ({}) - using lenient threshold: {}",
          topScore,
          retrieval.getLenientThreshold());
      return retrieval.getLenientThreshold();
    }
    log.debug("Medium top score ({}) - using base threshold: {}", topScore, baseThreshold);
    return baseThreshold;
  }

  public double resolveThreshold(List<Double> scores) {
    return resolveThreshold(scores, ragConfig.getRetrieval().getMinSimilarityScore());
  }

  /** Keeps chunks whose active score is at least the resolved threshold, preserving order. */
  public List<ScoredChunk> filter(List<ScoredChunk> rankedChunks, double baseThreshold) {
    if (rankedChunks.isEmpty()) {
      return List.of();
    }
    double threshold =
        resolveThreshold(rankedChunks.stream().map(ScoredChunk::getScore).toList(), baseThreshold);
    List<ScoredChunk> kept = rankedChunks.stream().filter(c -> c.getScore() >= threshold).toList();
    log.info(
        "Retrieved {}/{} chunks above adaptive threshold {} (base: {})",
        kept.size(),
        rankedChunks.size(),
        threshold,
        baseThreshold);
    return kept;
  }

  public List<ScoredChunk> filter(List<ScoredChunk> rankedChunks) {
    return filter(rankedChunks, ragConfig.getRetrieval().getMinSimilarityScore());
  }
}
