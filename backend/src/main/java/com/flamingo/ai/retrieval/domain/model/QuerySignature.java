package com.flamingo.ai.retrieval.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalized form of a retrieval request, used as the response-cache key and in request traces.
 *
 * <p>The query is lower-cased and trimmed and document ids are deduplicated and sorted, so two
 * requests that only differ in case, surrounding whitespace or doc-id order share a signature.
 */
public record QuerySignature(String normalizedQuery, List<String> sortedDocIds, int topK) {

  private static final ObjectMapper CANONICAL_MAPPER =
      new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

  public QuerySignature {
    sortedDocIds = List.copyOf(sortedDocIds);
  }

  public static QuerySignature of(String query, Collection<String> docIds, int topK) {
    String normalized = query == null ? "" : query.toLowerCase(Locale.ROOT).strip();
    List<String> sorted =
        docIds == null ? List.of() : docIds.stream().distinct().sorted().toList();
    return new QuerySignature(normalized, sorted, topK);
  }

  /** SHA-256 hex digest of the canonical JSON form {@code {doc_ids, query, top_k}}. */
  public String digest() {
    Map<String, Object> keyData = new TreeMap<>();
    keyData.put("query", normalizedQuery);
    keyData.put("doc_ids", sortedDocIds);
    keyData.put("top_k", topK);
    try {
      String canonical = CANONICAL_MAPPER.writeValueAsString(keyData);
      return Hashing.sha256().hashString(canonical, StandardCharsets.UTF_8).toString();
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize query signature", e);
    }
  }
}
