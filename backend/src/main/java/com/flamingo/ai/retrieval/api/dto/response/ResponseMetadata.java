package com.flamingo.ai.retrieval.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** How a retrieval response was produced. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResponseMetadata {

  private double responseTimeMs;
  private boolean cached;
  private String searchMethod;
  private boolean rerankerUsed;
  private boolean mmrUsed;
  private List<String> degradedStages;
  private int numChunksRetrieved;
  private LocalDateTime timestamp;
}
