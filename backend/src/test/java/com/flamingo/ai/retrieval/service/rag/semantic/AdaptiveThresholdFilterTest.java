package com.flamingo.ai.retrieval.service.rag.semantic;

import static com.flamingo.ai.retrieval.TestChunks.scored;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AdaptiveThresholdFilter Tests")
class AdaptiveThresholdFilterTest {

  private AdaptiveThresholdFilter filter;

  @BeforeEach
  void setUp() {
    filter = new AdaptiveThresholdFilter(new RagConfig());
  }

  @Nested
  @DisplayName("Threshold resolution")
  class Resolution {

    @Test
    @DisplayName("Should use the strict threshold when the top score is above 0.7")
    void shouldUseStrictThresholdForHighTopScore() {
      assertThat(filter.resolveThreshold(List.of(0.9, 0.6, 0.5))).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should use the lenient threshold when the top score is below 0.4")
    void shouldUseLenientThresholdForLowTopScore() {
      assertThat(filter.resolveThreshold(List.of(0.35, 0.2))).isEqualTo(0.2);
    }

    @Test
    @DisplayName("Should use the base threshold for a medium top score")
    void shouldUseBaseThresholdOtherwise() {
      assertThat(filter.resolveThreshold(List.of(0.5, 0.4))).isEqualTo(0.3);
      assertThat(filter.resolveThreshold(List.of(0.5, 0.4), 0.35)).isEqualTo(0.35);
    }

    @Test
    @DisplayName("Should treat the 0.7 and 0.4 boundaries as medium confidence")
    void shouldTreatBoundariesAsMedium() {
      assertThat(filter.resolveThreshold(List.of(0.7))).isEqualTo(0.3);
      assertThat(filter.resolveThreshold(List.of(0.4))).isEqualTo(0.3);
    }

    @Test
    @DisplayName("Should return the base threshold for an empty batch")
    void shouldReturnBaseForEmptyBatch() {
      assertThat(filter.resolveThreshold(List.of(), 0.25)).isEqualTo(0.25);
    }
  }

  @Nested
  @DisplayName("Filtering")
  class Filtering {

    @Test
    @DisplayName("Should drop chunks strictly below the resolved threshold")
    void shouldDropChunksBelowThreshold() {
      List<ScoredChunk> kept =
          filter.filter(List.of(scored(1, 0.9), scored(2, 0.5), scored(3, 0.49)));

      assertThat(kept).extracting(ScoredChunk::getId).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("Should keep weak matches when even the best is mediocre")
    void shouldKeepWeakMatchesWithLenientThreshold() {
      List<ScoredChunk> kept =
          filter.filter(List.of(scored(1, 0.35), scored(2, 0.2), scored(3, 0.19)));

      assertThat(kept).extracting(ScoredChunk::getId).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("Should return an empty result for an empty batch")
    void shouldHandleEmptyBatch() {
      assertThat(filter.filter(List.of())).isEmpty();
    }
  }
}
