package com.flamingo.ai.retrieval.domain.model;

import com.flamingo.ai.retrieval.domain.enums.PipelineStage;
import com.flamingo.ai.retrieval.domain.enums.RetrievalMode;
import java.util.List;
import java.util.Set;

/**
 * Output of one pipeline run: the ranked chunks plus what happened on the way.
 *
 * @param query the preprocessed query the pipeline ran with
 * @param chunks ranked chunks, empty when nothing relevant was found
 * @param mode the retrieval mode that produced the initial ranking
 * @param rerankerUsed whether the reranking stage ran
 * @param mmrUsed whether MMR diversification ran
 * @param candidatesRetrieved number of candidates fetched before downselection
 * @param degradedStages stages that fell back to their degraded mode
 * @param cached whether this result was served from the response cache
 */
public record RetrievalResult(
    String query,
    List<ScoredChunk> chunks,
    RetrievalMode mode,
    boolean rerankerUsed,
    boolean mmrUsed,
    int candidatesRetrieved,
    Set<PipelineStage> degradedStages,
    boolean cached) {

  public RetrievalResult {
    chunks = List.copyOf(chunks);
    degradedStages = Set.copyOf(degradedStages);
  }

  public static RetrievalResult empty(String query, RetrievalMode mode) {
    return new RetrievalResult(query, List.of(), mode, false, false, 0, Set.of(), false);
  }

  public boolean isEmpty() {
    return chunks.isEmpty();
  }

  public boolean isDegraded() {
    return !degradedStages.isEmpty();
  }

  /** Copy flagged as a cache hit; the chunk list is shared with the cached instance. */
  public RetrievalResult asCached() {
    return new RetrievalResult(
        query, chunks, mode, rerankerUsed, mmrUsed, candidatesRetrieved, degradedStages, true);
  }
}
