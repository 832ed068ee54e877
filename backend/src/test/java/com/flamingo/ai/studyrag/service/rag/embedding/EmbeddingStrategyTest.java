package com.flamingo.ai.studyrag.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.studyrag.exception.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("EmbeddingStrategy Tests")
class EmbeddingStrategyTest {

  @Test
  @DisplayName("Should accept the configured strategy names regardless of case")
  void shouldParseStrategyNames() {
    assertThat(EmbeddingStrategy.fromConfig("hosted")).isEqualTo(EmbeddingStrategy.HOSTED);
    assertThat(EmbeddingStrategy.fromConfig(" Hashing ")).isEqualTo(EmbeddingStrategy.HASHING);
  }

  @ParameterizedTest
  @ValueSource(strings = {"openai", "local", "hash", ""})
  @DisplayName("Should reject names that do not select a configured embedder")
  void shouldRejectOtherNames(String value) {
    assertThatThrownBy(() -> EmbeddingStrategy.fromConfig(value))
        .isInstanceOf(ConfigException.class)
        .extracting(e -> ((ConfigException) e).getSetting())
        .isEqualTo("rag.embedding.strategy");
  }
}
