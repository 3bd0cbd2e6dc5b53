package com.flamingo.ai.retrieval.domain.model;

import java.util.Arrays;
import java.util.Objects;
import lombok.Builder;

/**
 * Immutable retrieval unit read from the chunk store.
 *
 * <p>{@code title} and {@code filename} are denormalized from the owning document for display.
 * {@code embedding} may be {@code null} when the store did not return the vector.
 */
@Builder(toBuilder = true)
public record Chunk(
    long id,
    String docId,
    Integer chunkIndex,
    Integer page,
    String text,
    float[] embedding,
    String title,
    String filename) {

  public Chunk {
    Objects.requireNonNull(docId, "docId");
    text = text == null ? "" : text;
  }

  public boolean hasEmbedding() {
    return embedding != null && embedding.length > 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Chunk other)) {
      return false;
    }
    return id == other.id
        && docId.equals(other.docId)
        && Objects.equals(chunkIndex, other.chunkIndex)
        && Objects.equals(page, other.page)
        && text.equals(other.text)
        && Arrays.equals(embedding, other.embedding)
        && Objects.equals(title, other.title)
        && Objects.equals(filename, other.filename);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(id, docId, chunkIndex, page, text, title, filename);
    return 31 * result + Arrays.hashCode(embedding);
  }

  @Override
  public String toString() {
    return "Chunk[id=" + id + ", docId=" + docId + ", page=" + page + ", filename=" + filename
        + "]";
  }
}
