package com.flamingo.ai.retrieval.service.cache;

import com.flamingo.ai.retrieval.domain.model.QuerySignature;
import com.flamingo.ai.retrieval.domain.model.RetrievalResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded in-memory cache of complete retrieval results.
 *
 * <p>Eviction is FIFO by insertion order, not LRU: reading an entry never moves it. Replacing the
 * value of an existing key keeps its original position. Every operation runs under the cache
 * monitor, so the check-expire-delete and check-full-evict-insert sequences are atomic.
 */
@Slf4j
public class ResponseCache {

  private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
  private final int maxSize;
  private final Duration ttl;
  private final Clock clock;

  public ResponseCache(int maxSize, Duration ttl, Clock clock) {
    if (maxSize < 1) {
      throw new IllegalArgumentException("Cache max size must be positive: " + maxSize);
    }
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("Cache ttl must be positive: " + ttl);
    }
    this.maxSize = maxSize;
    this.ttl = ttl;
    this.clock = clock;
    log.info("Initialized response cache (max_size={}, ttl={})", maxSize, ttl);
  }

  public Optional<RetrievalResult> get(String query, Collection<String> docIds, int topK) {
    return get(QuerySignature.of(query, docIds, topK));
  }

  public synchronized Optional<RetrievalResult> get(QuerySignature signature) {
    String key = signature.digest();
    CacheEntry entry = entries.get(key);
    if (entry == null) {
      log.debug("Cache MISS for query: '{}'", abbreviate(signature.normalizedQuery()));
      return Optional.empty();
    }
    if (entry.isExpired(Instant.now(clock), ttl)) {
      entries.remove(key);
      log.info("Cache EXPIRED for query: '{}'", abbreviate(signature.normalizedQuery()));
      return Optional.empty();
    }
    log.debug("Cache HIT for query: '{}'", abbreviate(signature.normalizedQuery()));
    return Optional.of(entry.response());
  }

  public void set(String query, Collection<String> docIds, int topK, RetrievalResult response) {
    set(QuerySignature.of(query, docIds, topK), response);
  }

  public synchronized void set(QuerySignature signature, RetrievalResult response) {
    String key = signature.digest();
    if (!entries.containsKey(key) && entries.size() >= maxSize) {
      Iterator<String> oldest = entries.keySet().iterator();
      oldest.next();
      oldest.remove();
      log.debug("Cache full, evicted oldest entry");
    }
    entries.put(key, new CacheEntry(response, Instant.now(clock)));
    log.debug(
        "Cached response for query: '{}' (cache size: {})",
        abbreviate(signature.normalizedQuery()),
        entries.size());
  }

  public synchronized void clear() {
    entries.clear();
    log.info("Response cache cleared");
  }

  public synchronized CacheStats stats() {
    return new CacheStats(entries.size(), maxSize, ttl);
  }

  private static String abbreviate(String query) {
    return query.length() <= 50 ? query : query.substring(0, 50) + "...";
  }
}
