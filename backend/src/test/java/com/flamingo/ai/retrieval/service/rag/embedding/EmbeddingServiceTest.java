package com.flamingo.ai.retrieval.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.exception.EmbeddingDimensionMismatchException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;

  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getEmbedding().setDimension(3);
    embeddingService = new EmbeddingService(embeddingModel, ragConfig, new SimpleMeterRegistry());
  }

  @Test
  @DisplayName("Should return the model's vector")
  void shouldEmbedQuery() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f})));

    assertThat(embeddingService.embedQuery("tesla range")).containsExactly(0.1f, 0.2f, 0.3f);
  }

  @Test
  @DisplayName("Should fail with a configuration error on a dimension mismatch")
  void shouldRejectWrongDimension() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f})));

    assertThatThrownBy(() -> embeddingService.embedQuery("tesla range"))
        .isInstanceOf(EmbeddingDimensionMismatchException.class)
        .hasMessageContaining("expected 3 but got 2");
  }

  @Test
  @DisplayName("Should truncate very long queries before embedding")
  void shouldTruncateLongQueries() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {1f, 0f, 0f})));

    embeddingService.embedQuery("a".repeat(6000));

    ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(captor.capture());
    assertThat(captor.getValue()).hasSize(5000);
  }
}
