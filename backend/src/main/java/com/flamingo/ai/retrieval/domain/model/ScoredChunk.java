package com.flamingo.ai.retrieval.domain.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A chunk plus the scoring envelope accumulated across pipeline stages.
 *
 * <p>Per-stage fields stay {@code null} when the stage did not run. {@link #getScore()} is the
 * active ranking score: it is overwritten by the vector or BM25 stage, then by RRF fusion, then by
 * the reranker. MMR only records {@code mmrScore}.
 */
@Getter
@Setter
@ToString
public class ScoredChunk {

  private final Chunk chunk;

  private double score;

  private Double vectorScore;
  private Double bm25Score;
  private Double rrfScore;
  private Double rerankerScore;
  private Double originalScore;
  private Double mmrScore;

  private Integer vectorRank;
  private Integer bm25Rank;

  public ScoredChunk(Chunk chunk) {
    this(chunk, 0.0);
  }

  public ScoredChunk(Chunk chunk, double score) {
    this.chunk = chunk;
    this.score = score;
  }

  public long getId() {
    return chunk.id();
  }

  public String getDocId() {
    return chunk.docId();
  }

  public String getText() {
    return chunk.text();
  }

  public float[] getEmbedding() {
    return chunk.embedding();
  }

  public boolean hasEmbedding() {
    return chunk.hasEmbedding();
  }
}
