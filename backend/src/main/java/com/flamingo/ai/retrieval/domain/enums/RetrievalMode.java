package com.flamingo.ai.retrieval.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Which signals produce the initial candidate ranking. */
@Getter
@RequiredArgsConstructor
public enum RetrievalMode {
  /** BM25 over the full candidate set. */
  LEXICAL("lexical", "_lexical"),

  /** Nearest-neighbour lookup with the adaptive similarity threshold. */
  SEMANTIC("vector", ""),

  /** BM25 and cosine rankings fused with Reciprocal Rank Fusion. */
  HYBRID("hybrid", "_hybrid");

  private final String searchMethod;
  private final String cacheSuffix;

  public static RetrievalMode fromHybridFlag(boolean useHybrid) {
    return useHybrid ? HYBRID : SEMANTIC;
  }
}
