package com.flamingo.ai.studyrag.service.ingestion;

/**
 * Result of embedding and indexing one content block.
 *
 * @param blockId content block id
 * @param position window index within the source
 * @param status outcome
 * @param error failure message, {@code null} on success
 */
public record BlockOutcome(String blockId, int position, Status status, String error) {

  public static BlockOutcome embedded(String blockId, int position) {
    return new BlockOutcome(blockId, position, Status.EMBEDDED, null);
  }

  public static BlockOutcome failed(String blockId, int position, String error) {
    return new BlockOutcome(blockId, position, Status.FAILED, error);
  }

  public boolean isEmbedded() {
    return status == Status.EMBEDDED;
  }

  /** Block outcome status. */
  public enum Status {
    EMBEDDED,
    FAILED
  }
}
