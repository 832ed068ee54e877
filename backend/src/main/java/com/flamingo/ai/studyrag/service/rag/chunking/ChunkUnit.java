package com.flamingo.ai.studyrag.service.rag.chunking;

import com.flamingo.ai.studyrag.exception.ConfigException;

/** Unit in which chunk windows are measured. */
public enum ChunkUnit {
  /** BPE tokens from the configured tokenizer. */
  TOKEN,
  /** Characters; used when no tokenizer is available. */
  CHAR;

  public static ChunkUnit fromConfig(String value) {
    if (value == null) {
      return TOKEN;
    }
    return switch (value.trim().toLowerCase()) {
      case "token", "tokens" -> TOKEN;
      case "char", "chars", "character" -> CHAR;
      default -> throw new ConfigException(
          "rag.chunking.strategy", "Unknown chunking strategy '" + value + "'");
    };
  }
}
