package com.flamingo.ai.retrieval.domain.model;

import com.flamingo.ai.retrieval.domain.enums.RetrievalMode;
import java.time.Duration;
import java.util.List;
import lombok.Builder;

/**
 * Parameters of a single retrieval call.
 *
 * @param query the user query
 * @param topK number of chunks the caller wants back
 * @param docIds optional document filter, empty for the whole corpus
 * @param mode lexical, semantic or hybrid initial ranking
 * @param useReranker whether to run the cross-encoder stage
 * @param useMmr whether to run MMR diversification
 * @param timeout deadline for slow collaborator calls, {@code null} for the configured default
 */
@Builder(toBuilder = true)
public record RetrievalQuery(
    String query,
    int topK,
    List<String> docIds,
    RetrievalMode mode,
    boolean useReranker,
    boolean useMmr,
    Duration timeout) {

  public RetrievalQuery {
    docIds = docIds == null ? List.of() : List.copyOf(docIds);
    mode = mode == null ? RetrievalMode.SEMANTIC : mode;
  }

  public static RetrievalQuery of(
      String query,
      int topK,
      List<String> docIds,
      boolean useHybrid,
      boolean useReranker,
      boolean useMmr) {
    return new RetrievalQuery(
        query, topK, docIds, RetrievalMode.fromHybridFlag(useHybrid), useReranker, useMmr, null);
  }

  /** Whether the pipeline should over-fetch candidates for a later downselecting stage. */
  public boolean needsOverFetch() {
    return useReranker || useMmr;
  }

  /** Suffix that keeps different pipeline configurations apart in the response cache. */
  public String cacheSuffix() {
    return mode.getCacheSuffix() + (useReranker ? "_reranker" : "") + (useMmr ? "_mmr" : "");
  }
}
