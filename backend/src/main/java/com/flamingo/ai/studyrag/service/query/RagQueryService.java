package com.flamingo.ai.studyrag.service.query;

import com.flamingo.ai.studyrag.exception.EmbeddingUnavailableException;
import com.flamingo.ai.studyrag.service.rag.answer.AnswerService;
import com.flamingo.ai.studyrag.service.rag.model.AnswerResult;
import com.flamingo.ai.studyrag.service.rag.model.PackedContext;
import com.flamingo.ai.studyrag.service.rag.model.RagQuery;
import com.flamingo.ai.studyrag.service.rag.model.RetrievedChunk;
import com.flamingo.ai.studyrag.service.rag.retrieval.ContextPacker;
import com.flamingo.ai.studyrag.service.rag.retrieval.RetrievalSettings;
import com.flamingo.ai.studyrag.service.rag.retrieval.Retriever;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

/**
 * Query path facade: retrieve, pack, answer.
 *
 * <p>Nothing on this path is persisted, so a cancelled request leaves no state behind. Cancellation
 * is observed between stages and inside interruptible remote calls.
 */
@RequiredArgsConstructor
@Slf4j
public class RagQueryService {

  private final Retriever retriever;
  private final ContextPacker contextPacker;
  private final AnswerService answerService;
  private final RetrievalSettings defaults;
  private final AsyncTaskExecutor queryExecutor;

  /** Retrieves chunks without packing or answering. */
  public List<RetrievedChunk> search(String text, Integer k, String deckId) {
    return retriever.retrieve(text, k != null ? k : defaults.topK(), deckId);
  }

  /** Answers with the configured {@code top-k} and context budget. */
  public AnswerResult ask(String text, String deckId, boolean sourcesOnly) {
    return ask(
        new RagQuery(text, deckId, defaults.topK(), defaults.maxContextTokens()), sourcesOnly);
  }

  /**
   * Answers a query.
   *
   * @param query the query
   * @param sourcesOnly list supporting sources without generating text
   * @return a best-effort answer, or {@link AnswerResult.Mode#NO_ANSWER} when nothing relevant is
   *     available
   * @throws com.flamingo.ai.studyrag.exception.IndexUnavailableException if the index fails
   * @throws CancellationException if the request was cancelled
   */
  @Timed(value = "query.ask", description = "Time to answer a query end to end")
  public AnswerResult ask(RagQuery query, boolean sourcesOnly) {
    List<RetrievedChunk> chunks;
    try {
      chunks = retriever.retrieve(query.text(), query.k(), query.deckId());
    } catch (EmbeddingUnavailableException e) {
      log.warn("Query embedding unavailable, returning no answer: {}", e.getMessage());
      return AnswerResult.noAnswer();
    }

    checkCancelled();
    PackedContext context = contextPacker.pack(chunks, query.maxContextTokens());

    checkCancelled();
    return answerService.answer(query.text(), context, sourcesOnly);
  }

  /**
   * Runs {@link #ask(RagQuery, boolean)} on the query executor. Cancelling the returned future with
   * {@code mayInterruptIfRunning} aborts the request at its next suspension point.
   */
  public Future<AnswerResult> submit(RagQuery query, boolean sourcesOnly) {
    return queryExecutor.submit(() -> ask(query, sourcesOnly));
  }

  private static void checkCancelled() {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Query cancelled");
    }
  }
}
