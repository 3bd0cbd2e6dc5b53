package com.flamingo.ai.retrieval.service.rag.semantic;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.model.Chunk;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import com.flamingo.ai.retrieval.exception.EmbeddingDimensionMismatchException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Scores a candidate batch by clamped cosine similarity against the query vector. */
@Component
@RequiredArgsConstructor
@Slf4j
public class SemanticScorer {

  private final RagConfig ragConfig;

  /**
   * Scores every candidate, setting both {@code vectorScore} and the active {@code score}. Chunks
   * without a stored vector score {@code 0}. Output order matches input order.
   *
   * @throws EmbeddingDimensionMismatchException if a vector does not have the configured dimension
   */
  public List<ScoredChunk> score(float[] queryVector, List<Chunk> candidates) {
    int dimension = ragConfig.getEmbedding().getDimension();
    if (queryVector.length != dimension) {
      throw new EmbeddingDimensionMismatchException("query vector", dimension, queryVector.length);
    }

    List<ScoredChunk> scored = new ArrayList<>(candidates.size());
    int missing = 0;
    for (Chunk chunk : candidates) {
      double similarity = 0.0;
      if (chunk.hasEmbedding()) {
        if (chunk.embedding().length != dimension) {
          throw new EmbeddingDimensionMismatchException(
              "chunk " + chunk.id(), dimension, chunk.embedding().length);
        }
        similarity = CosineSimilarity.clamped(queryVector, chunk.embedding());
      } else {
        missing++;
      }
      ScoredChunk scoredChunk = new ScoredChunk(chunk, similarity);
      scoredChunk.setVectorScore(similarity);
      scored.add(scoredChunk);
    }
    if (missing > 0) {
      log.debug("{} of {} candidates have no embedding, scored 0", missing, candidates.size());
    }
    return scored;
  }
}
