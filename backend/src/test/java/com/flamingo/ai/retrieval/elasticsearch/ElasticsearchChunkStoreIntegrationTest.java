package com.flamingo.ai.retrieval.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.model.Chunk;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import com.flamingo.ai.retrieval.exception.EmbeddingDimensionMismatchException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.hc.core5.http.HttpHost;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.elasticsearch.ElasticsearchContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the chunk store against a real Elasticsearch node: candidate fetch with and without a
 * document filter, k-NN search with local cosine re-scoring, and the startup mapping check.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("ElasticsearchChunkStore Integration Test")
class ElasticsearchChunkStoreIntegrationTest {

  private static final String INDEX = "retrieval-chunks-it";

  @Container
  private static final ElasticsearchContainer ELASTICSEARCH_CONTAINER =
      new ElasticsearchContainer("docker.elastic.co/elasticsearch/elasticsearch:9.0.2")
          .withEnv("xpack.security.enabled", "false")
          .withEnv("xpack.security.http.ssl.enabled", "false")
          .withStartupTimeout(Duration.ofMinutes(2));

  private Rest5Client restClient;
  private ElasticsearchClient elasticsearchClient;
  private RagConfig ragConfig;

  @BeforeEach
  void setUp() throws Exception {
    restClient =
        Rest5Client.builder(
                new HttpHost(
                    "http",
                    ELASTICSEARCH_CONTAINER.getHost(),
                    ELASTICSEARCH_CONTAINER.getMappedPort(9200)))
            .build();
    elasticsearchClient =
        new ElasticsearchClient(new Rest5ClientTransport(restClient, new JacksonJsonpMapper()));
    ragConfig = new RagConfig();
    ragConfig.getEmbedding().setDimension(3);

    elasticsearchClient.indices().delete(d -> d.index(INDEX).ignoreUnavailable(true));
    elasticsearchClient
        .indices()
        .create(
            c ->
                c.index(INDEX)
                    .mappings(
                        m ->
                            m.properties("chunkId", p -> p.long_(l -> l))
                                .properties("docId", p -> p.keyword(k -> k))
                                .properties("page", p -> p.integer(i -> i))
                                .properties("text", p -> p.text(t -> t))
                                .properties(
                                    "embedding",
                                    p ->
                                        p.denseVector(
                                            dv ->
                                                dv.dims(3)
                                                    .index(true)
                                                    .similarity(DenseVectorSimilarity.Cosine)))));

    index(3, "doc-b", "pasta recipe with garlic", new float[] {0f, 0f, 1f});
    index(1, "doc-a", "Tesla Model S range 400 miles", new float[] {1f, 0.1f, 0f});
    index(2, "doc-a", "Tesla battery warranty", new float[] {0.7f, 0.7f, 0f});
  }

  @AfterEach
  void tearDown() throws Exception {
    restClient.close();
  }

  private void index(long id, String docId, String text, float[] embedding) throws Exception {
    Map<String, Object> source = new LinkedHashMap<>();
    source.put("chunkId", id);
    source.put("docId", docId);
    source.put("page", 1);
    source.put("text", text);
    source.put("embedding", List.of(embedding[0], embedding[1], embedding[2]));
    elasticsearchClient.index(
        i -> i.index(INDEX).id(String.valueOf(id)).document(source).refresh(Refresh.True));
  }

  private ElasticsearchChunkStore store() {
    return new ElasticsearchChunkStore(
        elasticsearchClient, new SimpleMeterRegistry(), ragConfig, INDEX, 1000);
  }

  @Test
  @DisplayName("Should fetch every chunk ordered by chunk id")
  void shouldFetchAllCandidates() {
    List<Chunk> chunks = store().fetchCandidates(List.of());

    assertThat(chunks).extracting(Chunk::id).containsExactly(1L, 2L, 3L);
    assertThat(chunks.get(0).text()).isEqualTo("Tesla Model S range 400 miles");
    assertThat(chunks.get(0).embedding()).hasSize(3);
  }

  @Test
  @DisplayName("Should restrict candidates to the requested documents")
  void shouldFilterByDocument() {
    List<Chunk> chunks = store().fetchCandidates(List.of("doc-b"));

    assertThat(chunks).extracting(Chunk::docId).containsExactly("doc-b");
  }

  @Test
  @DisplayName("Should return nearest chunks re-scored by cosine similarity")
  void shouldFindNearestChunks() {
    List<ScoredChunk> nearest =
        store().fetchTopKBySimilarity(new float[] {1f, 0f, 0f}, 2, List.of());

    assertThat(nearest).extracting(ScoredChunk::getId).containsExactly(1L, 2L);
    assertThat(nearest.get(0).getScore()).isGreaterThan(nearest.get(1).getScore());
    assertThat(nearest.get(0).getVectorScore()).isEqualTo(nearest.get(0).getScore());
  }

  @Test
  @DisplayName("Should apply the document filter to nearest neighbor search")
  void shouldFilterNearestChunks() {
    List<ScoredChunk> nearest =
        store().fetchTopKBySimilarity(new float[] {1f, 0f, 0f}, 5, List.of("doc-b"));

    assertThat(nearest).extracting(ScoredChunk::getId).containsExactly(3L);
    assertThat(nearest.get(0).getScore()).isZero();
  }

  @Test
  @DisplayName("Should read the indexed vector dimension and reject a mismatch")
  void shouldVerifyMapping() throws Exception {
    assertThat(store().indexedVectorDimension()).isEqualTo(3);

    ragConfig.getEmbedding().setDimension(384);
    ElasticsearchChunkStore mismatched = store();
    assertThatThrownBy(mismatched::verifyIndexMapping)
        .isInstanceOf(EmbeddingDimensionMismatchException.class)
        .hasMessageContaining("expected 384 but got 3");
  }
}
