package com.flamingo.ai.retrieval.service.rag.semantic;

/**
 * Cosine similarity over float vectors, accumulated in double precision.
 *
 * <p>Every code path that compares a query vector with a chunk vector goes through this class, so
 * batch scoring and the index-assisted path produce identical values.
 */
public final class CosineSimilarity {

  private CosineSimilarity() {}

  /**
   * Raw cosine similarity in {@code [-1, 1]}; {@code 0} when either vector has zero magnitude.
   *
   * @throws IllegalArgumentException if the vectors differ in length
   */
  public static double raw(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector length mismatch: " + a.length + " vs " + b.length);
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  /** Cosine similarity clamped to {@code [0, 1]}. */
  public static double clamped(float[] a, float[] b) {
    double similarity = raw(a, b);
    if (similarity < 0.0) {
      return 0.0;
    }
    return Math.min(similarity, 1.0);
  }
}
