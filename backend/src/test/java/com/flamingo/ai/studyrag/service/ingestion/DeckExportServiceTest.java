package com.flamingo.ai.studyrag.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studyrag.service.rag.embedding.EmbeddingProfile;
import com.flamingo.ai.studyrag.service.rag.embedding.EmbeddingStrategy;
import com.flamingo.ai.studyrag.service.rag.index.LocalVectorIndex;
import com.flamingo.ai.studyrag.service.rag.model.VectorRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DeckExportService Tests")
class DeckExportServiceTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private static VectorRecord record(
      String id, String deckId, String text, String sourceId, int position) {
    return new VectorRecord(
        id, deckId, new float[] {1f, 0f}, new VectorRecord.Payload(text, sourceId, position, 5));
  }

  @Test
  @DisplayName("Should write one JSON line per record of the deck")
  void shouldExportDeckAsJsonLines() throws Exception {
    LocalVectorIndex index = new LocalVectorIndex(null, objectMapper, 1, new SimpleMeterRegistry());
    index.initialize(new EmbeddingProfile(EmbeddingStrategy.HASHING, "test", 2));
    index.upsert(
        List.of(
            record("r0", "deck-1", "first", "S1", 0),
            record("x0", "deck-2", "other", "S9", 0),
            record("r1", "deck-1", "second", "S1", 1)));
    DeckExportService exportService = new DeckExportService(index, objectMapper);
    StringWriter out = new StringWriter();

    long written = exportService.exportJsonLines("deck-1", out);

    String[] lines = out.toString().split("\n");
    assertThat(written).isEqualTo(2);
    assertThat(lines).hasSize(2);
    JsonNode first = objectMapper.readTree(lines[0]);
    assertThat(first.get("id").asText()).isEqualTo("r0");
    assertThat(first.get("deck_id").asText()).isEqualTo("deck-1");
    assertThat(first.get("source_id").asText()).isEqualTo("S1");
    assertThat(first.get("position").asInt()).isZero();
    assertThat(first.get("text").asText()).isEqualTo("first");
    assertThat(objectMapper.readTree(lines[1]).get("text").asText()).isEqualTo("second");
  }
}
