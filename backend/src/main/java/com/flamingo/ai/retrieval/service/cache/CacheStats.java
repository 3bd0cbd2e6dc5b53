package com.flamingo.ai.retrieval.service.cache;

import java.time.Duration;

/** Snapshot of the response cache occupancy. */
public record CacheStats(int size, int maxSize, Duration ttl) {

  public long ttlHours() {
    return ttl.toHours();
  }
}
