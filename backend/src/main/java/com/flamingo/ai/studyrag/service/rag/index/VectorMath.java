package com.flamingo.ai.studyrag.service.rag.index;

/** Similarity helpers shared by the index implementations. */
public final class VectorMath {

  private VectorMath() {}

  /** Cosine similarity; zero when either vector has zero norm. */
  public static double cosine(float[] a, float[] b) {
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

  /** Maps cosine similarity into {@code [0, 1]}, the same scale Elasticsearch reports. */
  public static double score(float[] query, float[] candidate) {
    double cosine = Math.max(-1.0, Math.min(1.0, cosine(query, candidate)));
    return (1.0 + cosine) / 2.0;
  }
}
