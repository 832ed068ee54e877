package com.flamingo.ai.studyrag.service.rag.model;

import java.util.List;

/**
 * Result of answering a query.
 *
 * @param text answer text; empty for {@link Mode#SOURCES_ONLY} and {@link Mode#NO_ANSWER}
 * @param sources cited chunks supporting the answer
 * @param mode how the answer was produced
 */
public record AnswerResult(String text, List<RetrievedChunk> sources, Mode mode) {

  public AnswerResult {
    sources = List.copyOf(sources);
  }

  public static AnswerResult noAnswer() {
    return new AnswerResult("", List.of(), Mode.NO_ANSWER);
  }

  public static AnswerResult sourcesOnly(List<RetrievedChunk> sources) {
    return new AnswerResult("", sources, Mode.SOURCES_ONLY);
  }

  public boolean hasAnswer() {
    return mode == Mode.GENERATED || mode == Mode.EXTRACTIVE;
  }

  /** How an answer was produced. */
  public enum Mode {
    GENERATED,
    EXTRACTIVE,
    SOURCES_ONLY,
    NO_ANSWER
  }
}
