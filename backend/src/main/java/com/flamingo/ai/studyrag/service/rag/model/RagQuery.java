package com.flamingo.ai.studyrag.service.rag.model;

/**
 * A question asked against the index. Not persisted.
 *
 * @param text natural-language query
 * @param deckId optional deck scope; {@code null} searches every deck
 * @param k number of chunks to retrieve
 * @param maxContextTokens token budget for the packed context
 */
public record RagQuery(String text, String deckId, int k, int maxContextTokens) {

  public RagQuery {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("query text must not be blank");
    }
    if (k <= 0) {
      throw new IllegalArgumentException("k must be positive, got " + k);
    }
    if (maxContextTokens <= 0) {
      throw new IllegalArgumentException(
          "maxContextTokens must be positive, got " + maxContextTokens);
    }
  }
}
