package com.flamingo.ai.retrieval.config;

import com.flamingo.ai.retrieval.service.cache.ResponseCache;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the process-wide response cache from {@code rag.cache.*}. */
@Configuration
public class CacheConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ResponseCache responseCache(RagConfig ragConfig, Clock clock) {
    RagConfig.Cache cache = ragConfig.getCache();
    return new ResponseCache(cache.getMaxSize(), cache.getTtl(), clock);
  }
}
