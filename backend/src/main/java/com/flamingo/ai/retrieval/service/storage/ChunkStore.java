package com.flamingo.ai.retrieval.service.storage;

import com.flamingo.ai.retrieval.domain.model.Chunk;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import com.flamingo.ai.retrieval.exception.SearchException;
import java.util.Collection;
import java.util.List;

/** Read access to indexed chunks. Implementations throw {@link SearchException} on read failure. */
public interface ChunkStore {

  /**
   * Fetches every chunk, or only those of the given documents.
   *
   * @param docIds document filter; {@code null} or empty for the whole corpus
   */
  List<Chunk> fetchCandidates(Collection<String> docIds);

  /**
   * Nearest-neighbor lookup. Returned chunks carry the clamped cosine similarity as both {@code
   * vectorScore} and {@code score}, ordered by descending score.
   */
  List<ScoredChunk> fetchTopKBySimilarity(float[] queryVector, int k, Collection<String> docIds);
}
