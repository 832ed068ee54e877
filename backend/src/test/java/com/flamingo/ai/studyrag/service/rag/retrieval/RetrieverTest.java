package com.flamingo.ai.studyrag.service.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studyrag.exception.EmbeddingUnavailableException;
import com.flamingo.ai.studyrag.exception.IndexUnavailableException;
import com.flamingo.ai.studyrag.service.rag.embedding.Embedder;
import com.flamingo.ai.studyrag.service.rag.index.VectorIndex;
import com.flamingo.ai.studyrag.service.rag.model.RetrievedChunk;
import com.flamingo.ai.studyrag.service.rag.model.ScoredRecord;
import com.flamingo.ai.studyrag.service.rag.model.VectorRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("Retriever Tests")
class RetrieverTest {

  private static final float[] QUERY_VECTOR = {1f, 0f};

  @Mock private Embedder embedder;
  @Mock private VectorIndex vectorIndex;

  private SimpleMeterRegistry meterRegistry;
  private Retriever retriever;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    retriever = new Retriever(embedder, vectorIndex, meterRegistry);
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  private static ScoredRecord scored(String id, double score, int position) {
    return new ScoredRecord(
        new VectorRecord(
            id, "deck-1", QUERY_VECTOR, new VectorRecord.Payload("text " + id, "S1", position, 5)),
        score);
  }

  @Test
  @DisplayName("Should map hits to chunks preserving score order")
  void shouldMapHitsInOrder() {
    when(embedder.embed("what is osmosis")).thenReturn(QUERY_VECTOR);
    when(vectorIndex.search(QUERY_VECTOR, 3, "deck-1"))
        .thenReturn(List.of(scored("a", 0.9, 2), scored("b", 0.7, 0)));

    List<RetrievedChunk> chunks = retriever.retrieve("what is osmosis", 3, "deck-1");

    assertThat(chunks).extracting(RetrievedChunk::recordId).containsExactly("a", "b");
    assertThat(chunks.get(0).text()).isEqualTo("text a");
    assertThat(chunks.get(0).position()).isEqualTo(2);
    assertThat(chunks).noneMatch(RetrievedChunk::isCited);
    assertThat(meterRegistry.counter("retrieval.chunks").count()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("Should return an empty list when nothing matches")
  void shouldReturnEmptyWhenNothingMatches() {
    when(embedder.embed(anyString())).thenReturn(QUERY_VECTOR);
    when(vectorIndex.search(any(), anyInt(), any())).thenReturn(List.of());

    assertThat(retriever.retrieve("anything", 5, "deck-1")).isEmpty();
  }

  @Test
  @DisplayName("Should propagate embedding and index failures")
  void shouldPropagateFailures() {
    when(embedder.embed("down")).thenThrow(new EmbeddingUnavailableException("down", null));
    assertThatThrownBy(() -> retriever.retrieve("down", 5, null))
        .isInstanceOf(EmbeddingUnavailableException.class);

    when(embedder.embed("broken")).thenReturn(QUERY_VECTOR);
    when(vectorIndex.search(QUERY_VECTOR, 5, null))
        .thenThrow(new IndexUnavailableException("index offline"));
    assertThatThrownBy(() -> retriever.retrieve("broken", 5, null))
        .isInstanceOf(IndexUnavailableException.class);
  }

  @Test
  @DisplayName("Should stop before embedding when the request is cancelled")
  void shouldStopWhenCancelled() {
    Thread.currentThread().interrupt();

    assertThatThrownBy(() -> retriever.retrieve("query", 5, null))
        .isInstanceOf(CancellationException.class);
    verify(embedder, never()).embed(anyString());
  }
}
