package com.flamingo.ai.studyrag.service.rag.answer;

import com.flamingo.ai.studyrag.service.rag.model.AnswerResult;
import com.flamingo.ai.studyrag.service.rag.model.PackedContext;

/** Produces answer text from a query and its packed context. */
public interface AnswerGenerator {

  /**
   * Generates an answer.
   *
   * @param query the user's question
   * @param context non-empty packed context
   * @return answer text
   * @throws com.flamingo.ai.studyrag.exception.GenerationFailureException if generation fails
   */
  String generate(String query, PackedContext context);

  /** Mode reported for answers from this generator. */
  AnswerResult.Mode mode();
}
