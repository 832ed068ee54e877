package com.flamingo.ai.studyrag.service.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studyrag.service.rag.index.VectorIndex;
import com.flamingo.ai.studyrag.service.rag.model.VectorRecord;
import java.io.IOException;
import java.io.Writer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Streams the stored chunks of a deck for backup or reprocessing. */
@RequiredArgsConstructor
@Slf4j
public class DeckExportService {

  private final VectorIndex vectorIndex;
  private final ObjectMapper objectMapper;

  /**
   * Writes one JSON object per line for every record of the deck, in insertion order.
   *
   * @param deckId deck to export, or {@code null} for the whole index
   * @param writer destination; not closed
   * @return number of rows written
   */
  public long exportJsonLines(String deckId, Writer writer) throws IOException {
    long count = 0;
    for (VectorRecord record : vectorIndex.export(deckId)) {
      writer.write(objectMapper.writeValueAsString(SourceRow.of(record)));
      writer.write('\n');
      count++;
    }
    writer.flush();
    log.info("Exported {} record(s) of deck {}", count, deckId);
    return count;
  }

  /** One exported row. */
  record SourceRow(
      String id,
      @JsonProperty("deck_id") String deckId,
      @JsonProperty("source_id") String sourceId,
      int position,
      String text) {

    static SourceRow of(VectorRecord record) {
      return new SourceRow(
          record.id(),
          record.deckId(),
          record.payload().sourceId(),
          record.payload().position(),
          record.payload().text());
    }
  }
}
