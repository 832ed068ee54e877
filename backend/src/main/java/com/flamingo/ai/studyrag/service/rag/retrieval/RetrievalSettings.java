package com.flamingo.ai.studyrag.service.rag.retrieval;

import com.flamingo.ai.studyrag.exception.ConfigException;

/**
 * Default query parameters.
 *
 * @param topK chunks retrieved per query
 * @param maxContextTokens token budget of the packed context
 */
public record RetrievalSettings(int topK, int maxContextTokens) {

  public RetrievalSettings {
    if (topK <= 0) {
      throw new ConfigException("rag.retrieval.top-k", "top-k must be positive, got " + topK);
    }
    if (maxContextTokens <= 0) {
      throw new ConfigException(
          "rag.retrieval.max-context-tokens",
          "max-context-tokens must be positive, got " + maxContextTokens);
    }
  }
}
