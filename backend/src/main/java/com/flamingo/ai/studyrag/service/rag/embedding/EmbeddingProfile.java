package com.flamingo.ai.studyrag.service.rag.embedding;

import com.flamingo.ai.studyrag.exception.ConfigException;
import java.util.Arrays;

/**
 * Identity of the vectors an {@link Embedder} produces. Two profiles are compatible only when all
 * fields match; vectors from different profiles must never share an index.
 *
 * @param strategy embedding strategy
 * @param model model name, or the hashing scheme name for {@link EmbeddingStrategy#HASHING}
 * @param dimensions vector length
 */
public record EmbeddingProfile(EmbeddingStrategy strategy, String model, int dimensions) {

  public EmbeddingProfile {
    if (strategy == null) {
      throw new ConfigException("rag.embedding.strategy", "Embedding strategy is required");
    }
    if (model == null || model.isBlank()) {
      throw new ConfigException("rag.embedding.model-name", "Embedding model name is required");
    }
    if (dimensions <= 0) {
      throw new ConfigException(
          "rag.embedding.dimensions", "Embedding dimensions must be positive, got " + dimensions);
    }
  }

  /** Throws {@link ConfigException} when {@code other} was built with a different profile. */
  public void requireCompatible(EmbeddingProfile other, String context) {
    if (!equals(other)) {
      throw new ConfigException(
          "rag.embedding",
          String.format(
              "%s was built with embedding profile %s but the configured profile is %s. "
                  + "Re-ingest the content or restore the original embedding configuration.",
              context, other.describe(), describe()));
    }
  }

  public String describe() {
    return strategy.name().toLowerCase() + ":" + model + ":" + dimensions;
  }

  /** Parses the output of {@link #describe()}. */
  public static EmbeddingProfile parse(String value) {
    String[] parts = value == null ? new String[0] : value.split(":");
    if (parts.length < 3) {
      throw new ConfigException("rag.embedding", "Malformed stored embedding profile: " + value);
    }
    String model = String.join(":", Arrays.copyOfRange(parts, 1, parts.length - 1));
    try {
      return new EmbeddingProfile(
          EmbeddingStrategy.fromConfig(parts[0]), model, Integer.parseInt(parts[parts.length - 1]));
    } catch (NumberFormatException e) {
      throw new ConfigException(
          "rag.embedding", "Malformed stored embedding profile: " + value, e);
    }
  }
}
