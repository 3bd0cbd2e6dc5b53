package com.flamingo.ai.retrieval.api.rest;

import com.flamingo.ai.retrieval.api.dto.request.RetrievalRequest;
import com.flamingo.ai.retrieval.api.dto.response.ResponseMetadata;
import com.flamingo.ai.retrieval.api.dto.response.RetrievalResponse;
import com.flamingo.ai.retrieval.api.dto.response.SourceResponse;
import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.enums.RetrievalMode;
import com.flamingo.ai.retrieval.domain.model.RetrievalQuery;
import com.flamingo.ai.retrieval.domain.model.RetrievalResult;
import com.flamingo.ai.retrieval.exception.NoRelevantResultsException;
import com.flamingo.ai.retrieval.service.rag.RetrievalService;
import com.flamingo.ai.retrieval.service.rag.highlight.PassageHighlighter;
import com.flamingo.ai.retrieval.service.rag.query.QueryPreprocessor;
import jakarta.validation.Valid;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for chunk retrieval. */
@RestController
@RequestMapping("/api/retrieve")
@RequiredArgsConstructor
@Slf4j
public class RetrievalController {

  private final RetrievalService retrievalService;
  private final QueryPreprocessor queryPreprocessor;
  private final PassageHighlighter passageHighlighter;
  private final RagConfig ragConfig;

  /** Retrieves ranked chunks for a query; 404 when nothing relevant was found. */
  @PostMapping
  public ResponseEntity<RetrievalResponse> retrieve(@Valid @RequestBody RetrievalRequest request) {
    long start = System.nanoTime();

    RetrievalMode mode =
        request.getMode() != null
            ? request.getMode()
            : RetrievalMode.fromHybridFlag(request.isUseHybrid());
    RetrievalQuery query =
        RetrievalQuery.builder()
            .query(request.getQuery())
            .topK(
                request.getTopK() != null
                    ? request.getTopK()
                    : ragConfig.getRetrieval().getDefaultTopK())
            .docIds(request.getDocIds())
            .mode(mode)
            .useReranker(request.isUseReranker())
            .useMmr(request.isUseMmr())
            .timeout(
                request.getTimeoutMs() != null ? Duration.ofMillis(request.getTimeoutMs()) : null)
            .build();

    RetrievalResult result = retrievalService.retrieve(query);
    if (result.isEmpty()) {
      throw new NoRelevantResultsException(request.getQuery(), mode.getSearchMethod());
    }

    List<String> keywords = queryPreprocessor.extractKeywords(result.query());
    List<SourceResponse> sources =
        result.chunks().stream()
            .map(
                chunk ->
                    SourceResponse.from(
                        chunk, passageHighlighter.highlight(chunk.getText(), keywords)))
            .toList();

    double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
    ResponseMetadata metadata =
        ResponseMetadata.builder()
            .responseTimeMs(elapsedMs)
            .cached(result.cached())
            .searchMethod(result.mode().getSearchMethod())
            .rerankerUsed(result.rerankerUsed())
            .mmrUsed(result.mmrUsed())
            .degradedStages(
                result.degradedStages().stream()
                    .map(stage -> stage.name().toLowerCase(Locale.ROOT))
                    .sorted()
                    .toList())
            .numChunksRetrieved(result.candidatesRetrieved())
            .timestamp(LocalDateTime.now())
            .build();

    log.info(
        "Retrieved {} sources in {} ms (cached={}, method={})",
        sources.size(),
        String.format("%.1f", elapsedMs),
        result.cached(),
        metadata.getSearchMethod());

    return ResponseEntity.ok(
        RetrievalResponse.builder()
            .query(request.getQuery())
            .sources(sources)
            .metadata(metadata)
            .build());
  }
}
