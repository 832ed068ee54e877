package com.flamingo.ai.studyrag.service.rag.model;

/**
 * A chunk returned for a query.
 *
 * @param recordId id of the underlying vector record
 * @param text chunk text (possibly truncated by the context packer)
 * @param score similarity score, higher is better
 * @param sourceId source the chunk came from
 * @param deckId deck the chunk belongs to
 * @param position window index within the source
 * @param citationIndex 1-based citation number, or {@link #UNCITED} before packing
 */
public record RetrievedChunk(
    String recordId,
    String text,
    double score,
    String sourceId,
    String deckId,
    int position,
    int citationIndex) {

  public static final int UNCITED = 0;

  public static RetrievedChunk from(ScoredRecord hit) {
    VectorRecord record = hit.record();
    VectorRecord.Payload payload = record.payload();
    return new RetrievedChunk(
        record.id(),
        payload.text(),
        hit.score(),
        payload.sourceId(),
        record.deckId(),
        payload.position(),
        UNCITED);
  }

  public RetrievedChunk withCitationIndex(int index) {
    return new RetrievedChunk(recordId, text, score, sourceId, deckId, position, index);
  }

  public RetrievedChunk withText(String newText) {
    return new RetrievedChunk(recordId, newText, score, sourceId, deckId, position, citationIndex);
  }

  public boolean isCited() {
    return citationIndex != UNCITED;
  }
}
