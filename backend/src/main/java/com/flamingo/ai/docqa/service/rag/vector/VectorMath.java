package com.flamingo.ai.docqa.service.rag.vector;

import com.flamingo.ai.docqa.exception.DimensionMismatchException;

/** Vector similarity helpers. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine similarity of two vectors.
   *
   * @return similarity in [-1, 1], or 0 when either vector has zero length
   * @throws DimensionMismatchException when the vectors differ in length
   */
  public static double cosine(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new DimensionMismatchException(a.length, b.length);
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
