package com.flamingo.ai.studyrag;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.studyrag.service.ingestion.DeckExportService;
import com.flamingo.ai.studyrag.service.ingestion.IngestionReport;
import com.flamingo.ai.studyrag.service.ingestion.IngestionService;
import com.flamingo.ai.studyrag.service.query.RagQueryService;
import com.flamingo.ai.studyrag.service.rag.embedding.Embedder;
import com.flamingo.ai.studyrag.service.rag.embedding.HashingEmbedder;
import com.flamingo.ai.studyrag.service.rag.index.VectorIndex;
import com.flamingo.ai.studyrag.service.rag.model.AnswerResult;
import com.flamingo.ai.studyrag.service.rag.model.SourceDocument;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Verifies the application context wires the local pipeline: hashing embedder, in-memory index and
 * extractive answers, so no API key or running service is needed.
 */
@SpringBootTest(
    properties = {
      "rag.embedding.strategy=hashing",
      "rag.embedding.dimensions=128",
      "rag.index.backend=local",
      "rag.index.storage-path=",
      "rag.generation.enabled=false"
    })
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;
  @Autowired private IngestionService ingestionService;
  @Autowired private RagQueryService ragQueryService;

  @Test
  @DisplayName("All pipeline beans should be available")
  void pipelineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(Embedder.class)).isInstanceOf(HashingEmbedder.class);
    assertThat(applicationContext.getBean(VectorIndex.class)).isNotNull();
    assertThat(applicationContext.getBean(DeckExportService.class)).isNotNull();
  }

  @Test
  @DisplayName("Should answer extractively from ingested content")
  void shouldAnswerFromIngestedContent() {
    IngestionReport report =
        ingestionService.ingestAll(
            List.of(
                new SourceDocument(
                    "bio-1",
                    "biology",
                    "Osmosis is the movement of water across a semipermeable membrane.")));

    AnswerResult answer = ragQueryService.ask("What is osmosis?", "biology", false);
    AnswerResult unknownDeck = ragQueryService.ask("What is osmosis?", "history", false);

    assertThat(report.embeddedBlocks()).isEqualTo(1);
    assertThat(answer.mode()).isEqualTo(AnswerResult.Mode.EXTRACTIVE);
    assertThat(answer.text()).contains("Osmosis");
    assertThat(unknownDeck.mode()).isEqualTo(AnswerResult.Mode.NO_ANSWER);
  }
}
