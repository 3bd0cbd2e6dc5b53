package com.flamingo.ai.retrieval.service.rag;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.enums.PipelineStage;
import com.flamingo.ai.retrieval.domain.model.Chunk;
import com.flamingo.ai.retrieval.domain.model.RetrievalQuery;
import com.flamingo.ai.retrieval.domain.model.RetrievalResult;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import com.flamingo.ai.retrieval.service.rag.diversity.MmrDiversifier;
import com.flamingo.ai.retrieval.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.retrieval.service.rag.fusion.ReciprocalRankFusion;
import com.flamingo.ai.retrieval.service.rag.lexical.Bm25Scorer;
import com.flamingo.ai.retrieval.service.rag.rerank.RerankingOrchestrator;
import com.flamingo.ai.retrieval.service.rag.semantic.AdaptiveThresholdFilter;
import com.flamingo.ai.retrieval.service.rag.semantic.SemanticScorer;
import com.flamingo.ai.retrieval.service.storage.ChunkStore;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one retrieval: initial ranking (lexical, semantic or hybrid), then optional reranking, then
 * MMR or plain truncation.
 *
 * <p>Candidate fetch and query embedding run concurrently, as do BM25 and cosine scoring; fusion
 * waits for both. Storage failures and configuration errors propagate. Optional stages that fail
 * are recorded in {@link RetrievalResult#degradedStages()} and the run continues.
 */
@Service
@Slf4j
public class RetrievalPipeline {

  private final ChunkStore chunkStore;
  private final EmbeddingService embeddingService;
  private final Bm25Scorer bm25Scorer;
  private final SemanticScorer semanticScorer;
  private final AdaptiveThresholdFilter thresholdFilter;
  private final ReciprocalRankFusion rankFusion;
  private final RerankingOrchestrator rerankingOrchestrator;
  private final MmrDiversifier mmrDiversifier;
  private final RagConfig ragConfig;
  private final Executor executor;

  public RetrievalPipeline(
      ChunkStore chunkStore,
      EmbeddingService embeddingService,
      Bm25Scorer bm25Scorer,
      SemanticScorer semanticScorer,
      AdaptiveThresholdFilter thresholdFilter,
      ReciprocalRankFusion rankFusion,
      RerankingOrchestrator rerankingOrchestrator,
      MmrDiversifier mmrDiversifier,
      RagConfig ragConfig,
      @Qualifier("retrievalExecutor") Executor executor) {
    this.chunkStore = chunkStore;
    this.embeddingService = embeddingService;
    this.bm25Scorer = bm25Scorer;
    this.semanticScorer = semanticScorer;
    this.thresholdFilter = thresholdFilter;
    this.rankFusion = rankFusion;
    this.rerankingOrchestrator = rerankingOrchestrator;
    this.mmrDiversifier = mmrDiversifier;
    this.ragConfig = ragConfig;
    this.executor = executor;
  }

  /**
   * Executes the pipeline for an already preprocessed query.
   *
   * @return ranked chunks, empty when nothing relevant was found
   */
  @Timed(value = "rag.pipeline", description = "Time for one retrieval pipeline run")
  public RetrievalResult run(RetrievalQuery request) {
    int topK = request.topK();
    int initialK =
        request.needsOverFetch()
            ? topK * ragConfig.getRetrieval().getCandidatesMultiplier()
            : topK;
    Set<PipelineStage> degraded = EnumSet.noneOf(PipelineStage.class);

    InitialRanking initial =
        switch (request.mode()) {
          case LEXICAL -> lexicalRanking(request, initialK);
          case HYBRID -> hybridRanking(request, initialK);
          case SEMANTIC -> semanticRanking(request, initialK);
        };
    if (initial.embeddingDegraded()) {
      degraded.add(PipelineStage.EMBEDDING);
    }
    List<ScoredChunk> chunks = initial.chunks();
    int candidatesRetrieved = chunks.size();
    log.info(
        "{} search returned {} candidates (requested {})",
        request.mode().getSearchMethod(),
        candidatesRetrieved,
        initialK);

    boolean rerankerUsed = false;
    if (request.useReranker() && !chunks.isEmpty()) {
      int keep =
          request.useMmr() ? Math.max(topK, ragConfig.getReranking().getMaxCandidates()) : topK;
      StageOutcome outcome =
          rerankingOrchestrator.rerank(request.query(), chunks, keep, request.timeout());
      chunks = outcome.chunks();
      rerankerUsed = true;
      if (outcome.degraded()) {
        degraded.add(PipelineStage.RERANKING);
      }
    }

    boolean mmrUsed = false;
    if (request.useMmr() && chunks.size() > topK) {
      StageOutcome outcome = mmrDiversifier.diversify(chunks, initial.queryVector(), topK);
      chunks = outcome.chunks();
      mmrUsed = true;
      if (outcome.degraded()) {
        degraded.add(PipelineStage.DIVERSITY);
      }
    } else if (chunks.size() > topK) {
      chunks = chunks.subList(0, topK);
    }

    return new RetrievalResult(
        request.query(),
        chunks,
        request.mode(),
        rerankerUsed,
        mmrUsed,
        candidatesRetrieved,
        degraded,
        false);
  }

  private InitialRanking lexicalRanking(RetrievalQuery request, int initialK) {
    CompletableFuture<List<Chunk>> candidates =
        async(() -> chunkStore.fetchCandidates(request.docIds()));
    CompletableFuture<float[]> queryVector =
        request.useMmr()
            ? async(() -> embeddingService.embedQuery(request.query()))
            : CompletableFuture.completedFuture(new float[0]);

    List<ScoredChunk> ranking = rankLexically(request.query(), join(candidates), initialK);
    return new InitialRanking(ranking, join(queryVector), false);
  }

  private InitialRanking hybridRanking(RetrievalQuery request, int initialK) {
    CompletableFuture<List<Chunk>> candidatesFuture =
        async(() -> chunkStore.fetchCandidates(request.docIds()));
    CompletableFuture<float[]> vectorFuture =
        async(() -> embeddingService.embedQuery(request.query()));
    List<Chunk> candidates = join(candidatesFuture);
    float[] queryVector = join(vectorFuture);

    if (candidates.isEmpty()) {
      log.warn("No chunks found for docIds={}", request.docIds());
      return new InitialRanking(List.of(), queryVector, false);
    }
    if (queryVector.length == 0) {
      log.warn("Query embedding unavailable, hybrid search degrading to lexical ranking");
      return new InitialRanking(
          rankLexically(request.query(), candidates, initialK), queryVector, true);
    }

    CompletableFuture<List<ScoredChunk>> bm25Future =
        async(() -> sortedByScore(bm25Scorer.score(request.query(), candidates)));
    CompletableFuture<List<ScoredChunk>> vectorRankingFuture =
        async(() -> sortedByScore(semanticScorer.score(queryVector, candidates)));
    List<ScoredChunk> fused = rankFusion.fuse(join(vectorRankingFuture), join(bm25Future));

    // Fused scores are not comparable to cosine thresholds: cut by position only.
    return new InitialRanking(limit(fused, initialK), queryVector, false);
  }

  private InitialRanking semanticRanking(RetrievalQuery request, int initialK) {
    float[] queryVector = embeddingService.embedQuery(request.query());
    if (queryVector.length == 0) {
      log.warn("Query embedding unavailable, semantic search degrading to lexical ranking");
      List<Chunk> candidates = chunkStore.fetchCandidates(request.docIds());
      return new InitialRanking(
          rankLexically(request.query(), candidates, initialK), queryVector, true);
    }
    List<ScoredChunk> nearest =
        chunkStore.fetchTopKBySimilarity(queryVector, initialK, request.docIds());
    return new InitialRanking(thresholdFilter.filter(nearest), queryVector, false);
  }

  /** BM25 ranking without a score cut-off; chunks sharing no term with the query are dropped. */
  private List<ScoredChunk> rankLexically(String query, List<Chunk> candidates, int initialK) {
    List<ScoredChunk> ranked = sortedByScore(bm25Scorer.score(query, candidates));
    List<ScoredChunk> matching =
        ranked.stream().filter(c -> Bm25Scorer.sharesTerm(query, c.getChunk().text())).toList();
    return limit(matching, initialK);
  }

  private static List<ScoredChunk> sortedByScore(List<ScoredChunk> chunks) {
    List<ScoredChunk> sorted = new ArrayList<>(chunks);
    sorted.sort(Comparator.comparingDouble(ScoredChunk::getScore).reversed());
    return sorted;
  }

  private static List<ScoredChunk> limit(List<ScoredChunk> chunks, int k) {
    return chunks.size() > k ? chunks.subList(0, k) : chunks;
  }

  private <T> CompletableFuture<T> async(Supplier<T> supplier) {
    return CompletableFuture.supplyAsync(supplier, executor);
  }

  /** Waits for a stage and rethrows its original exception. */
  private static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      if (e.getCause() instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }

  private record InitialRanking(
      List<ScoredChunk> chunks, float[] queryVector, boolean embeddingDegraded) {}
}
