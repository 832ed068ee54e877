package com.flamingo.ai.studyrag.service.rag.retrieval;

import com.flamingo.ai.studyrag.service.rag.embedding.Embedder;
import com.flamingo.ai.studyrag.service.rag.index.VectorIndex;
import com.flamingo.ai.studyrag.service.rag.model.RetrievedChunk;
import com.flamingo.ai.studyrag.service.rag.model.ScoredRecord;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Top-k similarity retrieval for a natural-language query.
 *
 * <p>The query is embedded with the same {@link Embedder} instance used for ingestion, so query and
 * stored vectors always share one embedding profile.
 */
@RequiredArgsConstructor
@Slf4j
public class Retriever {

  private final Embedder embedder;
  private final VectorIndex vectorIndex;
  private final MeterRegistry meterRegistry;

  /**
   * Retrieves the chunks most similar to {@code queryText}.
   *
   * @param queryText natural-language query
   * @param k maximum number of chunks
   * @param deckId optional deck scope
   * @return chunks ordered by descending score; empty when nothing matches
   * @throws com.flamingo.ai.studyrag.exception.EmbeddingUnavailableException if the query cannot
   *     be embedded
   * @throws com.flamingo.ai.studyrag.exception.IndexUnavailableException if the index fails
   * @throws CancellationException if the calling thread is interrupted
   */
  @Timed(value = "retrieval.retrieve", description = "Time to retrieve chunks for a query")
  public List<RetrievedChunk> retrieve(String queryText, int k, String deckId) {
    checkCancelled();
    float[] queryVector = embedder.embed(queryText);

    checkCancelled();
    List<ScoredRecord> hits = vectorIndex.search(queryVector, k, deckId);

    List<RetrievedChunk> chunks = new ArrayList<>(hits.size());
    for (ScoredRecord hit : hits) {
      chunks.add(RetrievedChunk.from(hit));
    }
    meterRegistry.counter("retrieval.chunks").increment(chunks.size());
    log.debug(
        "Retrieved {} chunk(s) for query '{}' (k={}, deck={})",
        chunks.size(),
        abbreviate(queryText),
        k,
        deckId);
    return chunks;
  }

  static void checkCancelled() {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Query cancelled");
    }
  }

  private static String abbreviate(String text) {
    return text.length() > 80 ? text.substring(0, 80) + "..." : text;
  }
}
