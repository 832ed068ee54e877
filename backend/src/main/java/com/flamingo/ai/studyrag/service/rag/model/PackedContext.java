package com.flamingo.ai.studyrag.service.rag.model;

import java.util.List;

/**
 * Token-bounded context handed to the answerer.
 *
 * @param text numbered context block, one {@code [n] text} entry per source
 * @param sources accepted chunks in citation order
 * @param tokenCount total tokens of the accepted chunk texts
 */
public record PackedContext(String text, List<RetrievedChunk> sources, int tokenCount) {

  public PackedContext {
    sources = List.copyOf(sources);
  }

  public static PackedContext empty() {
    return new PackedContext("", List.of(), 0);
  }

  public boolean isEmpty() {
    return sources.isEmpty();
  }
}
