package com.flamingo.ai.retrieval.service.cache;

import com.flamingo.ai.retrieval.domain.model.RetrievalResult;
import java.time.Duration;
import java.time.Instant;

/** A cached pipeline result and the instant it was stored. */
public record CacheEntry(RetrievalResult response, Instant cachedAt) {

  public boolean isExpired(Instant now, Duration ttl) {
    return !now.isBefore(cachedAt.plus(ttl));
  }
}
