package com.flamingo.ai.studyrag.service.ingestion;

import com.flamingo.ai.studyrag.exception.EmbeddingUnavailableException;
import com.flamingo.ai.studyrag.service.rag.chunking.TextChunker;
import com.flamingo.ai.studyrag.service.rag.embedding.Embedder;
import com.flamingo.ai.studyrag.service.rag.index.VectorIndex;
import com.flamingo.ai.studyrag.service.rag.model.ContentBlock;
import com.flamingo.ai.studyrag.service.rag.model.SourceDocument;
import com.flamingo.ai.studyrag.service.rag.model.VectorRecord;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Orchestrates ingestion: chunk, embed and index.
 *
 * <p>Sources are independent and run in parallel on the ingestion executor. Within a source, a
 * block that is blank or whose embedding fails is recorded as failed and the remaining blocks are
 * still indexed.
 * Index failures abort the batch with {@link
 * com.flamingo.ai.studyrag.exception.IndexUnavailableException}.
 */
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

  private static final String BLANK_BLOCK = "Block text is blank";

  private final TextChunker chunker;
  private final Embedder embedder;
  private final VectorIndex vectorIndex;
  private final Executor ingestionExecutor;
  private final MeterRegistry meterRegistry;

  /**
   * Ingests several sources concurrently.
   *
   * @param sources sources to ingest
   * @return per-source results in submission order
   */
  @Timed(value = "ingestion.batch", description = "Time to ingest a batch of sources")
  public IngestionReport ingestAll(List<SourceDocument> sources) {
    List<CompletableFuture<SourceIngestionResult>> futures = new ArrayList<>(sources.size());
    for (SourceDocument source : sources) {
      futures.add(CompletableFuture.supplyAsync(() -> ingest(source), ingestionExecutor));
    }

    List<SourceIngestionResult> results = new ArrayList<>(futures.size());
    try {
      for (CompletableFuture<SourceIngestionResult> future : futures) {
        results.add(future.join());
      }
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }

    IngestionReport report = new IngestionReport(results);
    log.info(
        "Ingested {} source(s): {} block(s), {} embedded, {} failed",
        results.size(),
        report.totalBlocks(),
        report.embeddedBlocks(),
        report.failedBlocks());
    return report;
  }

  /**
   * Ingests one source. Re-ingesting unchanged text rewrites the same record ids; records of
   * positions that no longer exist are removed.
   *
   * @param source the source
   * @return the per-source result
   */
  @Timed(value = "ingestion.source", description = "Time to ingest one source")
  public SourceIngestionResult ingest(SourceDocument source) {
    List<ContentBlock> blocks = chunker.chunk(source);
    List<BlockOutcome> outcomes = new ArrayList<>(blocks.size());
    List<VectorRecord> records = new ArrayList<>(blocks.size());

    List<ContentBlock> embeddable = new ArrayList<>(blocks.size());
    for (ContentBlock block : blocks) {
      if (!block.text().isBlank()) {
        embeddable.add(block);
      }
    }
    Map<String, EmbeddingAttempt> attempts = embedAll(embeddable);

    for (ContentBlock block : blocks) {
      EmbeddingAttempt attempt = attempts.get(block.id());
      if (attempt == null) {
        outcomes.add(BlockOutcome.failed(block.id(), block.position(), BLANK_BLOCK));
      } else if (attempt.vector() != null) {
        records.add(VectorRecord.of(block, attempt.vector()));
        outcomes.add(BlockOutcome.embedded(block.id(), block.position()));
      } else {
        outcomes.add(BlockOutcome.failed(block.id(), block.position(), attempt.error()));
      }
    }

    if (!records.isEmpty()) {
      vectorIndex.upsert(records);
    }
    Set<String> currentIds = new LinkedHashSet<>();
    for (ContentBlock block : blocks) {
      currentIds.add(block.id());
    }
    long removed = vectorIndex.deleteStale(source.deckId(), source.sourceId(), currentIds);

    SourceIngestionResult result =
        SourceIngestionResult.of(source.sourceId(), source.deckId(), outcomes, removed);
    if (result.failed() > 0) {
      meterRegistry.counter("ingestion.blocks.failed").increment(result.failed());
      log.warn(
          "Source {} (deck {}): {} of {} block(s) failed to embed",
          source.sourceId(),
          source.deckId(),
          result.failed(),
          result.blocks());
    } else {
      log.info(
          "Source {} (deck {}): indexed {} block(s)",
          source.sourceId(),
          source.deckId(),
          result.embedded());
    }
    meterRegistry.counter("ingestion.blocks.embedded").increment(result.embedded());
    return result;
  }

  /**
   * Embeds blocks with one batch call, falling back to one call per block when the batch fails.
   * Only the blocks whose own call fails are marked as failed.
   */
  private Map<String, EmbeddingAttempt> embedAll(List<ContentBlock> blocks) {
    Map<String, EmbeddingAttempt> attempts = new HashMap<>();
    if (blocks.isEmpty()) {
      return attempts;
    }
    List<String> texts = new ArrayList<>(blocks.size());
    for (ContentBlock block : blocks) {
      texts.add(block.text());
    }

    try {
      List<float[]> vectors = embedder.embedBatch(texts);
      for (int i = 0; i < blocks.size(); i++) {
        attempts.put(blocks.get(i).id(), new EmbeddingAttempt(vectors.get(i), null));
      }
      return attempts;
    } catch (EmbeddingUnavailableException | IllegalArgumentException e) {
      log.warn(
          "Batch embedding of {} block(s) failed, retrying block by block: {}",
          texts.size(),
          e.getMessage());
    }

    for (ContentBlock block : blocks) {
      try {
        attempts.put(block.id(), new EmbeddingAttempt(embedder.embed(block.text()), null));
      } catch (EmbeddingUnavailableException e) {
        log.warn(
            "Embedding failed for block {} at position {}: {}",
            block.id(),
            block.position(),
            e.getMessage());
        attempts.put(block.id(), new EmbeddingAttempt(null, "Embedding service unavailable"));
      } catch (IllegalArgumentException e) {
        log.warn(
            "Embedding rejected block {} at position {}: {}",
            block.id(),
            block.position(),
            e.getMessage());
        attempts.put(block.id(), new EmbeddingAttempt(null, "Rejected input: " + e.getMessage()));
      }
    }
    return attempts;
  }

  private record EmbeddingAttempt(float[] vector, String error) {}
}
