package com.flamingo.ai.retrieval.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TypeMapping;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.GetMappingResponse;
import co.elastic.clients.elasticsearch.indices.get_mapping.IndexMappingRecord;
import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.model.Chunk;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import com.flamingo.ai.retrieval.exception.EmbeddingDimensionMismatchException;
import com.flamingo.ai.retrieval.exception.SearchException;
import com.flamingo.ai.retrieval.service.rag.semantic.CosineSimilarity;
import com.flamingo.ai.retrieval.service.storage.ChunkStore;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Chunk store backed by an Elasticsearch index with a {@code dense_vector} field.
 *
 * <p>Index layout: {@code chunkId} (long), {@code docId} (keyword), {@code chunkIndex}, {@code
 * page}, {@code text}, {@code title}, {@code filename} and {@code embedding}. Nearest-neighbor
 * results are re-scored locally with {@link CosineSimilarity} so the index path and batch scoring
 * agree exactly.
 */
@Service
@Slf4j
public class ElasticsearchChunkStore implements ChunkStore {

  static final String EMBEDDING_FIELD = "embedding";
  static final String DOC_ID_FIELD = "docId";

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final int maxCandidates;
  private final int embeddingDimension;

  public ElasticsearchChunkStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      RagConfig ragConfig,
      @Value("${app.elasticsearch.index-name:retrieval-chunks}") String indexName,
      @Value("${app.elasticsearch.max-candidates:10000}") int maxCandidates) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = indexName;
    this.maxCandidates = maxCandidates;
    this.embeddingDimension = ragConfig.getEmbedding().getDimension();
  }

  /**
   * Verifies that the index's vector dimension matches the configured embedding dimension. A
   * missing or unreachable index is only logged; a mismatch aborts startup.
   */
  @PostConstruct
  public void verifyIndexMapping() {
    Integer dims;
    try {
      dims = indexedVectorDimension();
    } catch (IOException | RuntimeException e) {
      log.warn("Could not read mapping of index '{}': {}", indexName, e.getMessage());
      return;
    }
    if (dims == null) {
      log.warn("Index '{}' has no '{}' dense_vector mapping yet", indexName, EMBEDDING_FIELD);
      return;
    }
    if (dims != embeddingDimension) {
      throw new EmbeddingDimensionMismatchException("index " + indexName, embeddingDimension, dims);
    }
    log.info("Index '{}' vector dimension {} matches configuration", indexName, dims);
  }

  @VisibleForTesting
  Integer indexedVectorDimension() throws IOException {
    var indices = elasticsearchClient.indices();
    if (indices == null || !indices.exists(e -> e.index(indexName)).value()) {
      return null;
    }
    GetMappingResponse response = indices.getMapping(g -> g.index(indexName));
    IndexMappingRecord indexMapping = response.get(indexName);
    if (indexMapping == null) {
      return null;
    }
    TypeMapping mappings = indexMapping.mappings();
    Property embedding = mappings.properties().get(EMBEDDING_FIELD);
    if (embedding == null || !embedding.isDenseVector()) {
      return null;
    }
    return embedding.denseVector().dims();
  }

  @Override
  public List<Chunk> fetchCandidates(Collection<String> docIds) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .query(documentFilter(docIds))
                      .sort(so -> so.field(f -> f.field("chunkId")))
                      .size(maxCandidates));

      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<Chunk> chunks = mapHitsToChunks(response.hits().hits());
      log.debug("Fetched {} candidate chunks (docIds={})", chunks.size(), docIds);
      return chunks;
    } catch (IOException | RuntimeException e) {
      log.error("Candidate fetch failed: {}", e.getMessage());
      throw new SearchException("Candidate fetch", indexName, e);
    } finally {
      sample.stop(meterRegistry.timer("elasticsearch.candidates.duration"));
    }
  }

  @Override
  public List<ScoredChunk> fetchTopKBySimilarity(
      float[] queryVector, int k, Collection<String> docIds) {
    if (queryVector.length != embeddingDimension) {
      throw new EmbeddingDimensionMismatchException(
          "query vector", embeddingDimension, queryVector.length);
    }
    List<Float> vector = new ArrayList<>(queryVector.length);
    for (float f : queryVector) {
      vector.add(f);
    }

    Timer.Sample sample = Timer.start(meterRegistry);
    List<Chunk> hits;
    try {
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .knn(
                          kn ->
                              kn.field(EMBEDDING_FIELD)
                                  .queryVector(vector)
                                  .k(k)
                                  .numCandidates(Math.max(k * 2, 50))
                                  .filter(documentFilter(docIds)))
                      .size(k));

      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      hits = mapHitsToChunks(response.hits().hits());
    } catch (IOException | RuntimeException e) {
      log.error("Vector search failed: {}", e.getMessage());
      throw new SearchException("Vector search", indexName, e);
    } finally {
      sample.stop(meterRegistry.timer("elasticsearch.vectorsearch.duration"));
    }

    List<ScoredChunk> scored = new ArrayList<>(hits.size());
    for (Chunk chunk : hits) {
      double similarity = 0.0;
      if (chunk.hasEmbedding()) {
        if (chunk.embedding().length != embeddingDimension) {
          throw new EmbeddingDimensionMismatchException(
              "chunk " + chunk.id(), embeddingDimension, chunk.embedding().length);
        }
        similarity = CosineSimilarity.clamped(queryVector, chunk.embedding());
      }
      ScoredChunk scoredChunk = new ScoredChunk(chunk, similarity);
      scoredChunk.setVectorScore(similarity);
      scored.add(scoredChunk);
    }
    scored.sort(Comparator.comparingDouble(ScoredChunk::getScore).reversed());
    return scored;
  }

  private static Query documentFilter(Collection<String> docIds) {
    if (docIds == null || docIds.isEmpty()) {
      return Query.of(q -> q.matchAll(m -> m));
    }
    List<FieldValue> values = docIds.stream().map(FieldValue::of).toList();
    return Query.of(q -> q.terms(t -> t.field(DOC_ID_FIELD).terms(tv -> tv.value(values))));
  }

  @SuppressWarnings("unchecked")
  @VisibleForTesting
  static List<Chunk> mapHitsToChunks(List<Hit<Map>> hits) {
    List<Chunk> chunks = new ArrayList<>(hits.size());
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source == null) {
        continue;
      }
      chunks.add(
          Chunk.builder()
              .id(toLong(source.get("chunkId"), hit.id()))
              .docId(String.valueOf(source.get(DOC_ID_FIELD)))
              .chunkIndex(toInteger(source.get("chunkIndex")))
              .page(toInteger(source.get("page")))
              .text((String) source.get("text"))
              .title((String) source.get("title"))
              .filename((String) source.get("filename"))
              .embedding(toVector(source.get(EMBEDDING_FIELD)))
              .build());
    }
    return chunks;
  }

  private static long toLong(Object value, String fallbackId) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    return Long.parseLong(value != null ? value.toString() : fallbackId);
  }

  private static Integer toInteger(Object value) {
    return value instanceof Number number ? number.intValue() : null;
  }

  private static float[] toVector(Object value) {
    if (!(value instanceof List<?> list)) {
      return null;
    }
    float[] vector = new float[list.size()];
    for (int i = 0; i < list.size(); i++) {
      vector[i] = ((Number) list.get(i)).floatValue();
    }
    return vector;
  }
}
