package com.flamingo.ai.studyrag.service.rag.answer;

import com.flamingo.ai.studyrag.service.rag.model.AnswerResult;
import com.flamingo.ai.studyrag.service.rag.model.PackedContext;

/**
 * Returns the highest-scoring packed chunk verbatim. The packed text already respects the context
 * budget, so no further truncation is needed.
 */
public class ExtractiveAnswerGenerator implements AnswerGenerator {

  @Override
  public String generate(String query, PackedContext context) {
    return context.sources().get(0).text();
  }

  @Override
  public AnswerResult.Mode mode() {
    return AnswerResult.Mode.EXTRACTIVE;
  }
}
