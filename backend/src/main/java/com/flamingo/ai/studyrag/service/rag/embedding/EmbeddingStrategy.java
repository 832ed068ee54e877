package com.flamingo.ai.studyrag.service.rag.embedding;

import com.flamingo.ai.studyrag.exception.ConfigException;

/** Available embedding strategies. */
public enum EmbeddingStrategy {
  /** Remote embedding model (OpenAI). */
  HOSTED,
  /** Local feature-hashing embedder, no network access. */
  HASHING;

  public static EmbeddingStrategy fromConfig(String value) {
    if (value == null || value.isBlank()) {
      throw new ConfigException("rag.embedding.strategy", "Embedding strategy is required");
    }
    return switch (value.trim().toLowerCase()) {
      case "hosted" -> HOSTED;
      case "hashing" -> HASHING;
      default ->
          throw new ConfigException(
              "rag.embedding.strategy", "Unknown embedding strategy '" + value + "'");
    };
  }
}
