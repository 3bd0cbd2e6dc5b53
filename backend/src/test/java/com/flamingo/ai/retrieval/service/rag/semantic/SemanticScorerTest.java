package com.flamingo.ai.retrieval.service.rag.semantic;

import static com.flamingo.ai.retrieval.TestChunks.chunk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import com.flamingo.ai.retrieval.exception.EmbeddingDimensionMismatchException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SemanticScorer Tests")
class SemanticScorerTest {

  private SemanticScorer scorer;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getEmbedding().setDimension(3);
    scorer = new SemanticScorer(ragConfig);
  }

  @Test
  @DisplayName("Should score each candidate by clamped cosine similarity")
  void shouldScoreByCosine() {
    float[] query = {1f, 0f, 0f};
    List<ScoredChunk> scored =
        scorer.score(
            query,
            List.of(
                chunk(1, "same", new float[] {2f, 0f, 0f}),
                chunk(2, "orthogonal", new float[] {0f, 1f, 0f}),
                chunk(3, "opposite", new float[] {-1f, 0f, 0f})));

    assertThat(scored.get(0).getScore()).isCloseTo(1.0, within(1e-9));
    assertThat(scored.get(1).getScore()).isZero();
    assertThat(scored.get(2).getScore()).isZero();
    assertThat(scored).allSatisfy(c -> assertThat(c.getVectorScore()).isEqualTo(c.getScore()));
  }

  @Test
  @DisplayName("Should score chunks without an embedding as 0")
  void shouldScoreMissingEmbeddingAsZero() {
    List<ScoredChunk> scored =
        scorer.score(new float[] {1f, 1f, 0f}, List.of(chunk(7, "no vector")));

    assertThat(scored).singleElement().satisfies(c -> assertThat(c.getScore()).isZero());
  }

  @Test
  @DisplayName("Should treat a query vector of the wrong dimension as a configuration error")
  void shouldRejectQueryDimensionMismatch() {
    assertThatThrownBy(() -> scorer.score(new float[] {1f, 0f}, List.of()))
        .isInstanceOf(EmbeddingDimensionMismatchException.class)
        .hasMessageContaining("expected 3 but got 2");
  }

  @Test
  @DisplayName("Should treat a stored vector of the wrong dimension as a configuration error")
  void shouldRejectChunkDimensionMismatch() {
    assertThatThrownBy(
            () ->
                scorer.score(
                    new float[] {1f, 0f, 0f}, List.of(chunk(9, "bad", new float[] {1f, 0f}))))
        .isInstanceOf(EmbeddingDimensionMismatchException.class)
        .hasMessageContaining("chunk 9");
  }
}
