package com.flamingo.ai.retrieval.service.rag;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.model.QuerySignature;
import com.flamingo.ai.retrieval.domain.model.RetrievalQuery;
import com.flamingo.ai.retrieval.domain.model.RetrievalResult;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import com.flamingo.ai.retrieval.service.cache.ResponseCache;
import com.flamingo.ai.retrieval.service.rag.query.QueryPreprocessor;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for retrieval. Preprocesses the query, serves repeated requests from the response
 * cache and otherwise runs the pipeline.
 *
 * <p>Only complete, non-empty results are cached: a result produced while a stage was degraded is
 * returned but not stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalService {

  private final RetrievalPipeline pipeline;
  private final ResponseCache responseCache;
  private final QueryPreprocessor queryPreprocessor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Retrieves the best chunks for a query.
   *
   * @return ranked chunks; an empty list means no relevant results
   */
  public List<ScoredChunk> retrieve(
      String query,
      int k,
      List<String> docIds,
      boolean useHybrid,
      boolean useReranker,
      boolean useMmr) {
    return retrieve(RetrievalQuery.of(query, k, docIds, useHybrid, useReranker, useMmr)).chunks();
  }

  public RetrievalResult retrieve(RetrievalQuery request) {
    validate(request);

    String preprocessed = queryPreprocessor.preprocess(request.query());
    if (!preprocessed.equals(request.query())) {
      log.info("Preprocessed: '{}' -> '{}'", abbreviate(request.query()), abbreviate(preprocessed));
    }
    QuerySignature signature =
        QuerySignature.of(preprocessed + request.cacheSuffix(), request.docIds(), request.topK());

    Optional<RetrievalResult> cached = responseCache.get(signature);
    if (cached.isPresent()) {
      meterRegistry.counter("rag.retrieve.cache.hit").increment();
      log.info("Returning cached result for: '{}'", abbreviate(preprocessed));
      return cached.get().asCached();
    }
    meterRegistry.counter("rag.retrieve.cache.miss").increment();

    RetrievalResult result = pipeline.run(request.toBuilder().query(preprocessed).build());

    if (result.isEmpty()) {
      meterRegistry.counter("rag.retrieve.empty").increment();
      log.info("No relevant chunks for: '{}'", abbreviate(preprocessed));
    } else if (result.isDegraded()) {
      log.info("Not caching degraded result (stages: {})", result.degradedStages());
    } else {
      responseCache.set(signature, result);
    }
    return result;
  }

  private void validate(RetrievalQuery request) {
    if (request.query() == null || request.query().isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    int maxTopK = ragConfig.getRetrieval().getMaxTopK();
    if (request.topK() < 1 || request.topK() > maxTopK) {
      throw new IllegalArgumentException(
          "top_k must be between 1 and " + maxTopK + " but was " + request.topK());
    }
  }

  private static String abbreviate(String query) {
    return query.length() <= 50 ? query : query.substring(0, 50) + "...";
  }
}
