package com.flamingo.ai.studyrag.service.rag.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One stored vector with the payload needed to rebuild a retrieved chunk.
 *
 * @param id record id, equal to the {@link ContentBlock#id()} it was embedded from
 * @param deckId deck used for scoped search
 * @param vector embedding, length equal to the configured dimensions
 * @param payload original text and provenance
 */
public record VectorRecord(String id, String deckId, float[] vector, Payload payload) {

  public VectorRecord {
    vector = vector.clone();
  }

  /** Returns a copy; the stored vector cannot be changed through a record. */
  @Override
  public float[] vector() {
    return vector.clone();
  }

  public int dimensions() {
    return vector.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VectorRecord other)) {
      return false;
    }
    return Objects.equals(id, other.id)
        && Objects.equals(deckId, other.deckId)
        && Arrays.equals(vector, other.vector)
        && Objects.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(id, deckId, payload) + Arrays.hashCode(vector);
  }

  @Override
  public String toString() {
    return "VectorRecord[id=" + id + ", deckId=" + deckId + ", dimensions=" + vector.length + "]";
  }

  public static VectorRecord of(ContentBlock block, float[] vector) {
    return new VectorRecord(
        block.id(),
        block.deckId(),
        vector,
        new Payload(block.text(), block.sourceId(), block.position(), block.tokenCount()));
  }

  /**
   * Stored payload of a record.
   *
   * @param text original block text
   * @param sourceId source the block came from
   * @param position window index within the source
   * @param tokenCount chunking size of the block
   */
  public record Payload(String text, String sourceId, int position, int tokenCount) {}
}
