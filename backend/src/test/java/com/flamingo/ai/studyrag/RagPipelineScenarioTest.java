package com.flamingo.ai.studyrag;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studyrag.service.ingestion.IngestionService;
import com.flamingo.ai.studyrag.service.ingestion.SourceIngestionResult;
import com.flamingo.ai.studyrag.service.rag.answer.AnswerService;
import com.flamingo.ai.studyrag.service.rag.answer.ExtractiveAnswerGenerator;
import com.flamingo.ai.studyrag.service.rag.chunking.ChunkingSettings;
import com.flamingo.ai.studyrag.service.rag.chunking.JtokkitTextTokenizer;
import com.flamingo.ai.studyrag.service.rag.chunking.TextTokenizer;
import com.flamingo.ai.studyrag.service.rag.chunking.TokenWindowChunker;
import com.flamingo.ai.studyrag.service.rag.embedding.HashingEmbedder;
import com.flamingo.ai.studyrag.service.rag.index.LocalVectorIndex;
import com.flamingo.ai.studyrag.service.rag.model.AnswerResult;
import com.flamingo.ai.studyrag.service.rag.model.ContentBlock;
import com.flamingo.ai.studyrag.service.rag.model.PackedContext;
import com.flamingo.ai.studyrag.service.rag.model.RetrievedChunk;
import com.flamingo.ai.studyrag.service.rag.model.SourceDocument;
import com.flamingo.ai.studyrag.service.rag.retrieval.ContextPacker;
import com.flamingo.ai.studyrag.service.rag.retrieval.Retriever;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Ingest, retrieve, pack and answer with local components only. */
@DisplayName("RAG pipeline scenario")
class RagPipelineScenarioTest {

  private static final String[] WORDS = {"the", "cat", "sat", "on", "the", "mat"};

  private final TextTokenizer tokenizer = new JtokkitTextTokenizer();
  private final HashingEmbedder embedder = new HashingEmbedder(256, 7);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

  private LocalVectorIndex vectorIndex;
  private TokenWindowChunker chunker;
  private IngestionService ingestionService;
  private Retriever retriever;
  private ContextPacker contextPacker;

  @BeforeEach
  void setUp() {
    vectorIndex = new LocalVectorIndex(null, new ObjectMapper(), 512, meterRegistry);
    vectorIndex.initialize(embedder.profile());
    chunker = new TokenWindowChunker(ChunkingSettings.tokens(700, 100), tokenizer);
    ingestionService =
        new IngestionService(chunker, embedder, vectorIndex, Runnable::run, meterRegistry);
    retriever = new Retriever(embedder, vectorIndex, meterRegistry);
    contextPacker = new ContextPacker(tokenizer);
  }

  private static String words(int count) {
    List<String> words = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      words.add(WORDS[i % WORDS.length]);
    }
    return String.join(" ", words);
  }

  @Test
  @DisplayName("Should chunk, retrieve and pack a 1500-token source")
  void shouldRunEndToEnd() {
    String text = words(1500);
    assertThat(tokenizer.countTokens(text)).isEqualTo(1500);

    SourceIngestionResult ingested =
        ingestionService.ingest(new SourceDocument("S1", "deck-1", text));
    ingestionService.ingest(new SourceDocument("S2", "deck-2", "unrelated deck content"));

    assertThat(ingested.blocks()).isEqualTo(3);
    assertThat(ingested.isComplete()).isTrue();
    List<ContentBlock> blocks = chunker.chunk(text, "S1", "deck-1", 700, 100);
    assertThat(blocks).extracting(ContentBlock::position).containsExactly(0, 1, 2);
    for (int i = 1; i < blocks.size(); i++) {
      int previousEnd = Integer.parseInt(blocks.get(i - 1).metadata().get("end"));
      int start = Integer.parseInt(blocks.get(i).metadata().get("start"));
      assertThat(previousEnd - start).isEqualTo(100);
    }

    List<RetrievedChunk> chunks = retriever.retrieve("topic X", 5, "deck-1");
    assertThat(chunks).isNotEmpty().hasSizeLessThanOrEqualTo(3);
    assertThat(chunks).extracting(RetrievedChunk::deckId).containsOnly("deck-1");

    PackedContext context = contextPacker.pack(chunks, 50);
    assertThat(context.sources()).hasSize(1);
    assertThat(tokenizer.countTokens(context.sources().get(0).text())).isEqualTo(50);
    assertThat(context.tokenCount()).isEqualTo(50);

    AnswerResult answer =
        new AnswerService(
                new ExtractiveAnswerGenerator(), new ExtractiveAnswerGenerator(), meterRegistry)
            .answer("topic X", context, false);
    assertThat(answer.mode()).isEqualTo(AnswerResult.Mode.EXTRACTIVE);
    assertThat(answer.text()).isEqualTo(context.sources().get(0).text());
  }

  @Test
  @DisplayName("Should keep the index stable when a source is ingested twice")
  void shouldReingestDeterministically() {
    SourceDocument source = new SourceDocument("S1", "deck-1", words(1500));

    ingestionService.ingest(source);
    List<String> firstIds = new ArrayList<>();
    vectorIndex.export("deck-1").forEach(r -> firstIds.add(r.id()));
    ingestionService.ingest(source);
    List<String> secondIds = new ArrayList<>();
    vectorIndex.export("deck-1").forEach(r -> secondIds.add(r.id()));

    assertThat(vectorIndex.count("deck-1")).isEqualTo(3);
    assertThat(secondIds).containsExactlyElementsOf(firstIds);
  }
}
