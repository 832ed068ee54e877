package com.flamingo.ai.studyrag.service.ingestion;

import java.util.List;

/**
 * Per-source ingestion summary.
 *
 * @param sourceId the source
 * @param deckId the deck
 * @param blocks blocks produced by the chunker
 * @param embedded blocks embedded and written to the index
 * @param failed blocks whose embedding failed
 * @param removedStale records of a previous ingestion of this source that were removed
 * @param outcomes per-block outcomes ordered by position
 */
public record SourceIngestionResult(
    String sourceId,
    String deckId,
    int blocks,
    int embedded,
    int failed,
    long removedStale,
    List<BlockOutcome> outcomes) {

  public SourceIngestionResult {
    outcomes = List.copyOf(outcomes);
  }

  public static SourceIngestionResult of(
      String sourceId, String deckId, List<BlockOutcome> outcomes, long removedStale) {
    int embedded = (int) outcomes.stream().filter(BlockOutcome::isEmbedded).count();
    return new SourceIngestionResult(
        sourceId,
        deckId,
        outcomes.size(),
        embedded,
        outcomes.size() - embedded,
        removedStale,
        outcomes);
  }

  public boolean isComplete() {
    return failed == 0;
  }
}
