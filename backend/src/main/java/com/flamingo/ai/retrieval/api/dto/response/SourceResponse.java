package com.flamingo.ai.retrieval.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.retrieval.domain.model.Chunk;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One retrieved chunk as returned to API clients. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SourceResponse {

  private long chunkId;
  private String docId;
  private Integer page;
  private String title;
  private String filename;
  private double score;
  private Integer vectorRank;
  private Integer bm25Rank;
  private Double rerankerScore;
  private Double mmrScore;
  private String textPreview;

  public static SourceResponse from(ScoredChunk scored, String textPreview) {
    Chunk chunk = scored.getChunk();
    return SourceResponse.builder()
        .chunkId(chunk.id())
        .docId(chunk.docId())
        .page(chunk.page())
        .title(chunk.title())
        .filename(chunk.filename())
        .score(Math.round(scored.getScore() * 10000.0) / 10000.0)
        .vectorRank(scored.getVectorRank())
        .bm25Rank(scored.getBm25Rank())
        .rerankerScore(scored.getRerankerScore())
        .mmrScore(scored.getMmrScore())
        .textPreview(textPreview)
        .build();
  }
}
