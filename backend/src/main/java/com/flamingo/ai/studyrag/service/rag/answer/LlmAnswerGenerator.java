package com.flamingo.ai.studyrag.service.rag.answer;

import com.flamingo.ai.studyrag.agent.GroundedAnswerAgent;
import com.flamingo.ai.studyrag.exception.GenerationFailureException;
import com.flamingo.ai.studyrag.service.rag.model.AnswerResult;
import com.flamingo.ai.studyrag.service.rag.model.PackedContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Generates cited answers with the {@link GroundedAnswerAgent}. */
@RequiredArgsConstructor
@Slf4j
public class LlmAnswerGenerator implements AnswerGenerator {

  private final GroundedAnswerAgent agent;

  @Override
  public String generate(String query, PackedContext context) {
    String answer;
    try {
      answer = agent.answer(query, context.text());
    } catch (RuntimeException e) {
      throw new GenerationFailureException("Answer generation failed: " + e.getMessage(), e);
    }
    if (answer == null || answer.isBlank()) {
      throw new GenerationFailureException("Answer generation returned no text");
    }
    log.debug(
        "Generated answer of {} chars from {} source(s)",
        answer.length(),
        context.sources().size());
    return answer.strip();
  }

  @Override
  public AnswerResult.Mode mode() {
    return AnswerResult.Mode.GENERATED;
  }
}
