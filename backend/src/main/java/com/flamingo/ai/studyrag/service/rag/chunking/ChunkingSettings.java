package com.flamingo.ai.studyrag.service.rag.chunking;

import com.flamingo.ai.studyrag.exception.ConfigException;

/**
 * Immutable chunking configuration, validated on construction.
 *
 * @param unit window unit
 * @param size window size in {@code unit}s
 * @param overlap units shared by consecutive windows, strictly smaller than {@code size}
 * @param dedupe whether duplicate and near-empty windows are dropped
 * @param minChunkChars windows whose trimmed text is not longer than this are dropped when {@code
 *     dedupe} is on
 */
public record ChunkingSettings(
    ChunkUnit unit, int size, int overlap, boolean dedupe, int minChunkChars) {

  public ChunkingSettings {
    if (unit == null) {
      throw new ConfigException("rag.chunking.strategy", "Chunking unit is required");
    }
    validateWindow(size, overlap);
    if (minChunkChars < 0) {
      throw new ConfigException(
          "rag.chunking.min-chunk-chars", "min-chunk-chars must not be negative");
    }
  }

  public static ChunkingSettings tokens(int size, int overlap) {
    return new ChunkingSettings(ChunkUnit.TOKEN, size, overlap, false, 0);
  }

  public static ChunkingSettings chars(int size, int overlap) {
    return new ChunkingSettings(ChunkUnit.CHAR, size, overlap, false, 0);
  }

  /** Throws {@link ConfigException} unless {@code 0 <= overlap < size}. */
  public static void validateWindow(int size, int overlap) {
    if (size <= 0) {
      throw new ConfigException("rag.chunking.size", "Chunk size must be positive, got " + size);
    }
    if (overlap < 0) {
      throw new ConfigException(
          "rag.chunking.overlap", "Chunk overlap must not be negative, got " + overlap);
    }
    if (overlap >= size) {
      throw new ConfigException(
          "rag.chunking.overlap",
          String.format("Chunk overlap (%d) must be smaller than chunk size (%d)", overlap, size));
    }
  }

  public int stride() {
    return size - overlap;
  }
}
