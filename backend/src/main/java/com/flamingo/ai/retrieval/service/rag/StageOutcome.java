package com.flamingo.ai.retrieval.service.rag;

import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import java.util.List;
import java.util.Objects;

/**
 * Result of an optional pipeline stage: either the stage's output, or a best-effort fallback
 * ranking plus the reason the stage could not run.
 *
 * @param chunks the ranking to continue with
 * @param degraded whether the stage fell back
 * @param reason why the stage fell back, {@code null} on success
 */
public record StageOutcome(List<ScoredChunk> chunks, boolean degraded, String reason) {

  public StageOutcome {
    chunks = List.copyOf(chunks);
  }

  public static StageOutcome success(List<ScoredChunk> chunks) {
    return new StageOutcome(chunks, false, null);
  }

  public static StageOutcome degraded(List<ScoredChunk> fallback, String reason) {
    return new StageOutcome(fallback, true, Objects.requireNonNull(reason, "reason"));
  }
}
