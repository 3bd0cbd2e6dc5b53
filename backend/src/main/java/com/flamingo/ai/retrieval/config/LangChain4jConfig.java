package com.flamingo.ai.retrieval.config;

import com.flamingo.ai.retrieval.exception.RetrievalConfigurationException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Query embedding model. A missing API key is a startup failure, not a degraded mode. */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.timeout-seconds:30}")
  private long timeoutSeconds;

  @Bean
  public EmbeddingModel embeddingModel(RagConfig ragConfig) {
    validateApiKey();
    log.info(
        "Query embeddings from {} ({} dimensions)",
        embeddingModelName,
        ragConfig.getEmbedding().getDimension());

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .baseUrl(baseUrl)
        .modelName(embeddingModelName)
        .dimensions(ragConfig.getEmbedding().getDimension())
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new RetrievalConfigurationException(
          "No embedding model available: OpenAI API key is missing. Set OPENAI_API_KEY.");
    }
  }
}
