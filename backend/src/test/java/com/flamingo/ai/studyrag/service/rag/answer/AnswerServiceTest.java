package com.flamingo.ai.studyrag.service.rag.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studyrag.exception.GenerationFailureException;
import com.flamingo.ai.studyrag.service.rag.model.AnswerResult;
import com.flamingo.ai.studyrag.service.rag.model.PackedContext;
import com.flamingo.ai.studyrag.service.rag.model.RetrievedChunk;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnswerService Tests")
class AnswerServiceTest {

  @Mock private AnswerGenerator generator;

  private SimpleMeterRegistry meterRegistry;
  private AnswerService answerService;
  private PackedContext context;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    lenient().when(generator.mode()).thenReturn(AnswerResult.Mode.GENERATED);
    answerService = new AnswerService(generator, new ExtractiveAnswerGenerator(), meterRegistry);

    List<RetrievedChunk> sources =
        List.of(
            new RetrievedChunk("r1", "Osmosis moves water.", 0.9, "S1", "deck-1", 0, 1),
            new RetrievedChunk("r2", "Diffusion moves solutes.", 0.8, "S1", "deck-1", 1, 2));
    context =
        new PackedContext("[1] Osmosis moves water.\n\n[2] Diffusion moves solutes.", sources, 9);
  }

  @Test
  @DisplayName("Should return the generated answer with its sources")
  void shouldReturnGeneratedAnswer() {
    when(generator.generate("what is osmosis", context)).thenReturn("Water movement [1].");

    AnswerResult result = answerService.answer("what is osmosis", context, false);

    assertThat(result.mode()).isEqualTo(AnswerResult.Mode.GENERATED);
    assertThat(result.text()).isEqualTo("Water movement [1].");
    assertThat(result.sources()).hasSize(2);
  }

  @Test
  @DisplayName("Should fall back to the top chunk when generation fails")
  void shouldFallBackWhenGenerationFails() {
    when(generator.generate(anyString(), any()))
        .thenThrow(new GenerationFailureException("Answer generation returned no text"));

    AnswerResult result = answerService.answer("what is osmosis", context, false);

    assertThat(result.mode()).isEqualTo(AnswerResult.Mode.EXTRACTIVE);
    assertThat(result.text()).isEqualTo("Osmosis moves water.");
    assertThat(result.hasAnswer()).isTrue();
    assertThat(meterRegistry.counter("answer.generation.fallback").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should list sources without generating in sources-only mode")
  void shouldListSourcesOnly() {
    AnswerResult result = answerService.answer("what is osmosis", context, true);

    assertThat(result.mode()).isEqualTo(AnswerResult.Mode.SOURCES_ONLY);
    assertThat(result.text()).isEmpty();
    assertThat(result.sources()).extracting(RetrievedChunk::recordId).containsExactly("r1", "r2");
    verify(generator, never()).generate(anyString(), any());
  }

  @Test
  @DisplayName("Should return the no-answer marker for an empty context")
  void shouldReturnNoAnswerForEmptyContext() {
    AnswerResult result = answerService.answer("what is osmosis", PackedContext.empty(), false);

    assertThat(result.mode()).isEqualTo(AnswerResult.Mode.NO_ANSWER);
    assertThat(result.hasAnswer()).isFalse();
    verify(generator, never()).generate(anyString(), any());
  }

  @Test
  @DisplayName("Should propagate cancellation instead of falling back")
  void shouldPropagateCancellation() {
    when(generator.generate(anyString(), any())).thenThrow(new CancellationException("cancelled"));

    assertThatThrownBy(() -> answerService.answer("what is osmosis", context, false))
        .isInstanceOf(CancellationException.class);
  }
}
