package com.flamingo.ai.retrieval.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for the retrieval pipeline's parallel signal computation. */
@Configuration
public class AsyncConfig {

  /**
   * Runs candidate fetch, query embedding, BM25 and cosine scoring side by side, and hosts reranker
   * calls so they can be bounded by a deadline.
   */
  @Bean(name = "retrievalExecutor")
  public Executor retrievalExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("retrieval-");
    executor.initialize();
    return executor;
  }
}
