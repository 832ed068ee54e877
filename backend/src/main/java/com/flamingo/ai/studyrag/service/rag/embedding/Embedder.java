package com.flamingo.ai.studyrag.service.rag.embedding;

import java.util.List;

/**
 * Maps text to fixed-length vectors.
 *
 * <p>The implementation is chosen once at startup. Ingestion and query paths share the same
 * instance, so both always use the same {@link EmbeddingProfile}.
 */
public interface Embedder {

  EmbeddingProfile profile();

  /**
   * Embeds a single text.
   *
   * @param text the text
   * @return vector of length {@code profile().dimensions()}
   * @throws com.flamingo.ai.studyrag.exception.EmbeddingUnavailableException if the backing
   *     service stays unavailable after retries
   */
  float[] embed(String text);

  /**
   * Embeds texts in order. The result has the same size as the input and {@code result.get(i)} is
   * the vector of {@code texts.get(i)}.
   */
  List<float[]> embedBatch(List<String> texts);
}
