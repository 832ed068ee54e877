package com.flamingo.ai.studyrag.service.rag.answer;

import com.flamingo.ai.studyrag.service.rag.model.AnswerResult;
import com.flamingo.ai.studyrag.service.rag.model.PackedContext;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.CancellationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Best-effort answering over a packed context.
 *
 * <p>Generation failures degrade to the extractive fallback and are never surfaced to the caller.
 * Only an empty context produces {@link AnswerResult.Mode#NO_ANSWER}.
 */
@RequiredArgsConstructor
@Slf4j
public class AnswerService {

  private final AnswerGenerator generator;
  private final ExtractiveAnswerGenerator fallback;
  private final MeterRegistry meterRegistry;

  /**
   * Answers a query.
   *
   * @param query the question
   * @param context packed context from the retriever
   * @param sourcesOnly when set, skip generation and only list the cited sources
   * @return the answer with its sources
   */
  @Timed(value = "answer.answer", description = "Time to answer a query")
  public AnswerResult answer(String query, PackedContext context, boolean sourcesOnly) {
    if (context.isEmpty()) {
      return AnswerResult.noAnswer();
    }
    if (sourcesOnly) {
      return AnswerResult.sourcesOnly(context.sources());
    }
    try {
      String text = generator.generate(query, context);
      return new AnswerResult(text, context.sources(), generator.mode());
    } catch (CancellationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("Answer generation failed, using extractive fallback: {}", e.getMessage());
      meterRegistry.counter("answer.generation.fallback").increment();
      return extractive(query, context);
    }
  }

  /** Answers with the extractive fallback regardless of the configured generator. */
  public AnswerResult extractive(String query, PackedContext context) {
    if (context.isEmpty()) {
      return AnswerResult.noAnswer();
    }
    return new AnswerResult(fallback.generate(query, context), context.sources(), fallback.mode());
  }
}
