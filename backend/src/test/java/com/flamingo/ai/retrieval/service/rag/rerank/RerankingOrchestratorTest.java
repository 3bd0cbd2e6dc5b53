package com.flamingo.ai.retrieval.service.rag.rerank;

import static com.flamingo.ai.retrieval.TestChunks.ranked;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import com.flamingo.ai.retrieval.service.rag.StageOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RerankingOrchestrator Tests")
class RerankingOrchestratorTest {

  @Mock private PairwiseRelevanceScorer scorer;

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private RerankingOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    orchestrator = new RerankingOrchestrator(scorer, Runnable::run, ragConfig, meterRegistry);
  }

  @Nested
  @DisplayName("Successful reranking")
  class Success {

    @Test
    @DisplayName("Should reorder by reranker score and keep topK")
    void shouldReorderByRerankerScore() {
      List<ScoredChunk> candidates = ranked(4);
      when(scorer.scorePairs(anyString(), anyList(), any(Duration.class)))
          .thenReturn(List.of(0.1, 0.9, 0.5, 0.7));

      StageOutcome outcome = orchestrator.rerank("query", candidates, 3);

      assertThat(outcome.degraded()).isFalse();
      assertThat(outcome.chunks()).extracting(ScoredChunk::getId).containsExactly(2L, 4L, 3L);
      assertThat(outcome.chunks())
          .extracting(ScoredChunk::getScore)
          .containsExactly(0.9, 0.7, 0.5);
      assertThat(meterRegistry.counter("rag.rerank.invocations").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep the prior score as originalScore")
    void shouldRecordOriginalScore() {
      List<ScoredChunk> candidates = ranked(2);
      double prior = candidates.get(0).getScore();
      when(scorer.scorePairs(anyString(), anyList(), any(Duration.class)))
          .thenReturn(List.of(3.5, -1.0));

      StageOutcome outcome = orchestrator.rerank("query", candidates, 2);

      ScoredChunk top = outcome.chunks().get(0);
      assertThat(top.getRerankerScore()).isEqualTo(3.5);
      assertThat(top.getOriginalScore()).isEqualTo(prior);
    }

    @Test
    @DisplayName("Should not call the scorer for an empty batch")
    void shouldSkipEmptyBatch() {
      StageOutcome outcome = orchestrator.rerank("query", List.of(), 5);

      assertThat(outcome.chunks()).isEmpty();
      assertThat(outcome.degraded()).isFalse();
      verify(scorer, never()).scorePairs(anyString(), anyList(), any(Duration.class));
    }
  }

  @Nested
  @DisplayName("Fallback")
  class Fallback {

    @Test
    @DisplayName("Should return the first 6 of 10 items unchanged when the scorer fails")
    void shouldReturnInputOrderOnFailure() {
      List<ScoredChunk> candidates = ranked(10);
      when(scorer.scorePairs(anyString(), anyList(), any(Duration.class)))
          .thenThrow(new IllegalStateException("TEI unavailable"));

      StageOutcome outcome = orchestrator.rerank("query", candidates, 6);

      assertThat(outcome.degraded()).isTrue();
      assertThat(outcome.reason()).contains("TEI unavailable");
      assertThat(outcome.chunks()).containsExactlyElementsOf(candidates.subList(0, 6));
      assertThat(outcome.chunks()).allSatisfy(c -> assertThat(c.getRerankerScore()).isNull());
      assertThat(meterRegistry.counter("rag.rerank.fallback").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fall back when the scorer returns the wrong number of scores")
    void shouldFallBackOnMalformedReply() {
      List<ScoredChunk> candidates = ranked(3);
      when(scorer.scorePairs(anyString(), anyList(), any(Duration.class))).thenReturn(List.of(0.5));

      StageOutcome outcome = orchestrator.rerank("query", candidates, 2);

      assertThat(outcome.degraded()).isTrue();
      assertThat(outcome.chunks()).containsExactlyElementsOf(candidates.subList(0, 2));
    }

    @Test
    @DisplayName("Should fall back when reranking is disabled")
    void shouldFallBackWhenDisabled() {
      ragConfig.getReranking().setEnabled(false);
      List<ScoredChunk> candidates = ranked(5);

      StageOutcome outcome = orchestrator.rerank("query", candidates, 3);

      assertThat(outcome.degraded()).isTrue();
      assertThat(outcome.chunks()).containsExactlyElementsOf(candidates.subList(0, 3));
      verify(scorer, never()).scorePairs(anyString(), anyList(), any(Duration.class));
    }

    @Test
    @DisplayName("Should hand the request deadline to the scorer")
    void shouldPassDeadlineToScorer() {
      List<ScoredChunk> candidates = ranked(2);
      when(scorer.scorePairs(anyString(), anyList(), eq(Duration.ofMillis(120))))
          .thenReturn(List.of(0.4, 0.6));

      StageOutcome outcome = orchestrator.rerank("query", candidates, 2, Duration.ofMillis(120));

      assertThat(outcome.degraded()).isFalse();
      verify(scorer).scorePairs(anyString(), anyList(), eq(Duration.ofMillis(120)));
    }

    @Test
    @DisplayName("Should stop waiting at the deadline and fall back")
    void shouldFallBackOnDeadline() throws InterruptedException {
      ExecutorService executor = Executors.newSingleThreadExecutor();
      CountDownLatch release = new CountDownLatch(1);
      PairwiseRelevanceScorer slowScorer =
          (query, texts, timeout) -> {
            try {
              release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            return texts.stream().map(t -> 1.0).toList();
          };
      RerankingOrchestrator bounded =
          new RerankingOrchestrator(slowScorer, executor, ragConfig, meterRegistry);
      List<ScoredChunk> candidates = ranked(4);

      try {
        StageOutcome outcome = bounded.rerank("query", candidates, 2, Duration.ofMillis(50));

        assertThat(outcome.degraded()).isTrue();
        assertThat(outcome.reason()).contains("timed out");
        assertThat(outcome.chunks()).containsExactlyElementsOf(candidates.subList(0, 2));
      } finally {
        release.countDown();
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
      }
    }
  }
}
