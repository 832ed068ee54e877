package com.flamingo.ai.studyrag.service.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studyrag.exception.EmbeddingUnavailableException;
import com.flamingo.ai.studyrag.exception.IndexUnavailableException;
import com.flamingo.ai.studyrag.service.rag.answer.AnswerService;
import com.flamingo.ai.studyrag.service.rag.answer.ExtractiveAnswerGenerator;
import com.flamingo.ai.studyrag.service.rag.chunking.JtokkitTextTokenizer;
import com.flamingo.ai.studyrag.service.rag.model.AnswerResult;
import com.flamingo.ai.studyrag.service.rag.model.RagQuery;
import com.flamingo.ai.studyrag.service.rag.model.RetrievedChunk;
import com.flamingo.ai.studyrag.service.rag.retrieval.ContextPacker;
import com.flamingo.ai.studyrag.service.rag.retrieval.RetrievalSettings;
import com.flamingo.ai.studyrag.service.rag.retrieval.Retriever;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("RagQueryService Tests")
class RagQueryServiceTest {

  @Mock private Retriever retriever;

  private ThreadPoolTaskExecutor queryExecutor;
  private RagQueryService queryService;

  @BeforeEach
  void setUp() {
    queryExecutor = new ThreadPoolTaskExecutor();
    queryExecutor.setCorePoolSize(1);
    queryExecutor.initialize();
    AnswerService answerService =
        new AnswerService(
            new ExtractiveAnswerGenerator(),
            new ExtractiveAnswerGenerator(),
            new SimpleMeterRegistry());
    queryService =
        new RagQueryService(
            retriever,
            new ContextPacker(new JtokkitTextTokenizer()),
            answerService,
            new RetrievalSettings(5, 1600),
            queryExecutor);
  }

  @AfterEach
  void tearDown() {
    queryExecutor.shutdown();
  }

  private static RetrievedChunk chunk(String id, String text, double score) {
    return new RetrievedChunk(id, text, score, "S1", "deck-1", 0, RetrievedChunk.UNCITED);
  }

  @Test
  @DisplayName("Should answer from the best packed chunk with numbered sources")
  void shouldAnswerFromPackedContext() {
    when(retriever.retrieve("what is osmosis", 3, "deck-1"))
        .thenReturn(
            List.of(
                chunk("a", "Osmosis is the movement of water.", 0.9),
                chunk("b", "Diffusion moves solutes.", 0.6)));

    AnswerResult result =
        queryService.ask(new RagQuery("what is osmosis", "deck-1", 3, 1600), false);

    assertThat(result.mode()).isEqualTo(AnswerResult.Mode.EXTRACTIVE);
    assertThat(result.text()).isEqualTo("Osmosis is the movement of water.");
    assertThat(result.sources())
        .extracting(RetrievedChunk::citationIndex)
        .containsExactly(1, 2);
  }

  @Test
  @DisplayName("Should use the configured defaults for plain questions")
  void shouldUseDefaults() {
    when(retriever.retrieve("what is osmosis", 5, "deck-1")).thenReturn(List.of());

    AnswerResult result = queryService.ask("what is osmosis", "deck-1", true);

    assertThat(result.mode()).isEqualTo(AnswerResult.Mode.NO_ANSWER);
    verify(retriever).retrieve("what is osmosis", 5, "deck-1");
  }

  @Test
  @DisplayName("Should return the no-answer marker when the query cannot be embedded")
  void shouldReturnNoAnswerWhenEmbeddingUnavailable() {
    when(retriever.retrieve(anyString(), anyInt(), any()))
        .thenThrow(new EmbeddingUnavailableException("embedding service down", 4, null));

    AnswerResult result = queryService.ask("what is osmosis", null, false);

    assertThat(result.mode()).isEqualTo(AnswerResult.Mode.NO_ANSWER);
    assertThat(result.sources()).isEmpty();
  }

  @Test
  @DisplayName("Should surface index failures")
  void shouldSurfaceIndexFailures() {
    when(retriever.retrieve(anyString(), anyInt(), any()))
        .thenThrow(new IndexUnavailableException("index offline"));

    assertThatThrownBy(() -> queryService.ask("what is osmosis", null, false))
        .isInstanceOf(IndexUnavailableException.class);
  }

  @Test
  @DisplayName("Should search without packing or answering")
  void shouldSearch() {
    when(retriever.retrieve("osmosis", 5, "deck-1"))
        .thenReturn(List.of(chunk("a", "Osmosis.", 0.9)));

    assertThat(queryService.search("osmosis", null, "deck-1"))
        .extracting(RetrievedChunk::recordId)
        .containsExactly("a");
  }

  @Test
  @DisplayName("Should abort a submitted query when it is cancelled")
  void shouldCancelSubmittedQuery() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    when(retriever.retrieve(anyString(), anyInt(), any()))
        .thenAnswer(
            invocation -> {
              started.countDown();
              try {
                Thread.sleep(10_000);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Query cancelled");
              }
              return List.of();
            });

    Future<AnswerResult> future =
        queryService.submit(new RagQuery("what is osmosis", "deck-1", 5, 1600), false);
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    future.cancel(true);

    assertThat(future.isCancelled()).isTrue();
    assertThatThrownBy(future::get).isInstanceOf(CancellationException.class);
  }
}
