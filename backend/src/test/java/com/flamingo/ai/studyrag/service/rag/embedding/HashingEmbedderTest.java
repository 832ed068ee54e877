package com.flamingo.ai.studyrag.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.studyrag.service.rag.index.VectorMath;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HashingEmbedder Tests")
class HashingEmbedderTest {

  private final HashingEmbedder embedder = new HashingEmbedder(256, 7);

  @Test
  @DisplayName("Should produce identical vectors for identical text")
  void shouldBeReproducible() {
    String text = "Mitochondria are the powerhouse of the cell.";

    assertThat(embedder.embed(text)).containsExactly(new HashingEmbedder(256, 7).embed(text));
  }

  @Test
  @DisplayName("Should produce unit-length vectors of the configured dimensions")
  void shouldProduceNormalizedVectors() {
    float[] vector = embedder.embed("The French Revolution began in 1789.");

    assertThat(vector).hasSize(256);
    double norm = 0;
    for (float v : vector) {
      norm += v * v;
    }
    assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
  }

  @Test
  @DisplayName("Should score near-duplicates above unrelated text")
  void shouldScoreNearDuplicatesHigher() {
    float[] original = embedder.embed("Mitochondria are the powerhouse of the cell");
    float[] nearDuplicate = embedder.embed("mitochondria are the powerhouse of a cell!");
    float[] unrelated = embedder.embed("Quarterly revenue grew in the northern sales region");

    assertThat(VectorMath.cosine(original, nearDuplicate))
        .isGreaterThan(VectorMath.cosine(original, unrelated));
    assertThat(VectorMath.cosine(original, nearDuplicate)).isGreaterThan(0.7);
  }

  @Test
  @DisplayName("Should return the zero vector for blank text")
  void shouldReturnZeroVectorForBlankText() {
    assertThat(embedder.embed("   ")).containsOnly(0.0f);
  }

  @Test
  @DisplayName("Should embed batches in input order")
  void shouldPreserveBatchOrder() {
    List<float[]> vectors = embedder.embedBatch(List.of("alpha", "beta", "gamma"));

    assertThat(vectors).hasSize(3);
    assertThat(vectors.get(1)).containsExactly(embedder.embed("beta"));
  }

  @Test
  @DisplayName("Should change vectors with the seed and report its profile")
  void shouldDependOnSeed() {
    HashingEmbedder otherSeed = new HashingEmbedder(256, 8);

    assertThat(otherSeed.embed("cell biology")).isNotEqualTo(embedder.embed("cell biology"));
    assertThat(embedder.profile().describe()).isEqualTo("hashing:murmur3-shingles:256");
  }
}
