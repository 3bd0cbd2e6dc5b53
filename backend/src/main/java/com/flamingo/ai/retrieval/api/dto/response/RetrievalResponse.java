package com.flamingo.ai.retrieval.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a retrieval call. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalResponse {

  private String query;
  private List<SourceResponse> sources;
  private ResponseMetadata metadata;
}
