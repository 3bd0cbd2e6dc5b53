package com.flamingo.ai.retrieval.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.retrieval.domain.enums.RetrievalMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a retrieval call. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RetrievalRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 1000, message = "Query must not exceed 1000 characters")
  private String query;

  @Min(value = 1, message = "top_k must be at least 1")
  @Max(value = 20, message = "top_k must be at most 20")
  @Builder.Default
  private Integer topK = 6;

  /** Restrict retrieval to these documents; empty searches everything. */
  private List<String> docIds;

  @Builder.Default private boolean useHybrid = false;

  @Builder.Default private boolean useReranker = false;

  @Builder.Default private boolean useMmr = false;

  /** Optional explicit mode; overrides {@code use_hybrid} when set. */
  private RetrievalMode mode;

  @Positive(message = "timeout_ms must be positive")
  private Long timeoutMs;
}
