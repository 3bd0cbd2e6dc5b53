package com.flamingo.ai.retrieval.service.rag.fusion;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reciprocal Rank Fusion: {@code rrf = Σ 1/(k + rank)} over every list a chunk appears in, with
 * 1-indexed ranks.
 *
 * <p>Fused scores are small (roughly 0.01 to 0.05 for top results at {@code k = 60}). Downstream
 * truncation must use position, never compare them to a similarity threshold.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReciprocalRankFusion {

  private final RagConfig ragConfig;

  /**
   * Fuses a vector ranking with a BM25 ranking. Records {@code vectorRank} and {@code bm25Rank} on
   * the fused chunks and overwrites {@code score} with the fused score.
   */
  public List<ScoredChunk> fuse(List<ScoredChunk> vectorRanking, List<ScoredChunk> bm25Ranking) {
    log.info(
        "Applying RRF fusion: {} vector + {} BM25 results",
        vectorRanking.size(),
        bm25Ranking.size());
    List<ScoredChunk> fused = fuseAll(List.of(vectorRanking, bm25Ranking));

    Map<Long, Integer> vectorRanks = ranksById(vectorRanking);
    Map<Long, Integer> bm25Ranks = ranksById(bm25Ranking);
    for (ScoredChunk chunk : fused) {
      chunk.setVectorRank(vectorRanks.get(chunk.getId()));
      chunk.setBm25Rank(bm25Ranks.get(chunk.getId()));
    }

    if (!fused.isEmpty()) {
      ScoredChunk top = fused.get(0);
      log.debug(
          "Top result: RRF={}, vector_rank={}, bm25_rank={}",
          String.format("%.4f", top.getRrfScore()),
          top.getVectorRank(),
          top.getBm25Rank());
    }
    return fused;
  }

  /**
   * Fuses any number of rankings of the same id space. Ties keep the order in which chunks were
   * first seen, so the first list wins. The returned chunk for an id is the first instance seen;
   * scores from the other lists are copied onto it when it lacks them.
   */
  public List<ScoredChunk> fuseAll(List<List<ScoredChunk>> rankings) {
    int rrfK = ragConfig.getRetrieval().getRrfK();
    Map<Long, Double> rrfScores = new LinkedHashMap<>();
    Map<Long, ScoredChunk> chunksById = new LinkedHashMap<>();

    for (List<ScoredChunk> ranking : rankings) {
      for (int i = 0; i < ranking.size(); i++) {
        ScoredChunk chunk = ranking.get(i);
        rrfScores.merge(chunk.getId(), 1.0 / (rrfK + i + 1), Double::sum);
        ScoredChunk existing = chunksById.putIfAbsent(chunk.getId(), chunk);
        if (existing != null && existing != chunk) {
          carrySignalScores(chunk, existing);
        }
      }
    }

    List<ScoredChunk> fused = new ArrayList<>(chunksById.values());
    for (ScoredChunk chunk : fused) {
      double rrf = rrfScores.get(chunk.getId());
      chunk.setRrfScore(rrf);
      chunk.setScore(rrf);
    }
    // List.sort is stable: equal scores keep first-encounter order.
    fused.sort(Comparator.comparingDouble(ScoredChunk::getScore).reversed());

    log.info("RRF fusion complete: {} combined results", fused.size());
    return fused;
  }

  private static void carrySignalScores(ScoredChunk from, ScoredChunk to) {
    if (to.getVectorScore() == null) {
      to.setVectorScore(from.getVectorScore());
    }
    if (to.getBm25Score() == null) {
      to.setBm25Score(from.getBm25Score());
    }
  }

  private static Map<Long, Integer> ranksById(List<ScoredChunk> ranking) {
    Map<Long, Integer> ranks = new LinkedHashMap<>();
    for (int i = 0; i < ranking.size(); i++) {
      ranks.putIfAbsent(ranking.get(i).getId(), i + 1);
    }
    return ranks;
  }
}
