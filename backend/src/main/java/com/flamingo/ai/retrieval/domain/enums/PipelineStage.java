package com.flamingo.ai.retrieval.domain.enums;

/** Pipeline stages that can run in a degraded mode. */
public enum PipelineStage {
  EMBEDDING,
  RERANKING,
  DIVERSITY
}
