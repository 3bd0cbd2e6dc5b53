package com.flamingo.ai.retrieval.service.rag.rerank;

import java.time.Duration;
import java.util.List;

/** Cross-encoder style scorer for (query, passage) pairs. */
public interface PairwiseRelevanceScorer {

  /**
   * Scores every text against the query in one batched call.
   *
   * @param timeout how long the call may wait on the scoring backend before failing
   * @return one score per text, in the same order as {@code texts}
   */
  List<Double> scorePairs(String query, List<String> texts, Duration timeout);
}
