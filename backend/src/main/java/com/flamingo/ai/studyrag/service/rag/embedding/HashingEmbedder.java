package com.flamingo.ai.studyrag.service.rag.embedding;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic embedder based on signed feature hashing.
 *
 * <p>Features are lower-cased word unigrams, word bigrams and character trigrams of each word. Each
 * feature is hashed with seeded Murmur3 into one of {@code dimensions} buckets with a hash-derived
 * sign, and the vector is L2-normalised. Texts sharing words and word fragments share buckets, so
 * near-duplicates have high cosine similarity while unrelated texts stay close to zero.
 */
public class HashingEmbedder implements Embedder {

  public static final String MODEL_NAME = "murmur3-shingles";

  private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final float UNIGRAM_WEIGHT = 1.0f;
  private static final float BIGRAM_WEIGHT = 0.75f;
  private static final float TRIGRAM_WEIGHT = 0.5f;

  private final EmbeddingProfile profile;
  private final HashFunction hashFunction;

  public HashingEmbedder(int dimensions, int seed) {
    this.profile = new EmbeddingProfile(EmbeddingStrategy.HASHING, MODEL_NAME, dimensions);
    this.hashFunction = Hashing.murmur3_128(seed);
  }

  @Override
  public EmbeddingProfile profile() {
    return profile;
  }

  @Override
  public float[] embed(String text) {
    float[] vector = new float[profile.dimensions()];
    if (text == null || text.isBlank()) {
      return vector;
    }

    String previous = null;
    for (String word : WORD_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
      if (word.isEmpty()) {
        continue;
      }
      accumulate(vector, "w:" + word, UNIGRAM_WEIGHT);
      if (previous != null) {
        accumulate(vector, "b:" + previous + " " + word, BIGRAM_WEIGHT);
      }
      String padded = "#" + word + "#";
      for (int i = 0; i + 3 <= padded.length(); i++) {
        accumulate(vector, "c:" + padded.substring(i, i + 3), TRIGRAM_WEIGHT);
      }
      previous = word;
    }

    normalize(vector);
    return vector;
  }

  @Override
  public List<float[]> embedBatch(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (String text : texts) {
      vectors.add(embed(text));
    }
    return vectors;
  }

  private void accumulate(float[] vector, String feature, float weight) {
    long hash = hashFunction.hashString(feature, StandardCharsets.UTF_8).asLong();
    int bucket = (int) Math.floorMod(hash, (long) vector.length);
    float sign = ((hash >>> 63) == 0) ? 1.0f : -1.0f;
    vector[bucket] += sign * weight;
  }

  private static void normalize(float[] vector) {
    double sumOfSquares = 0.0;
    for (float v : vector) {
      sumOfSquares += (double) v * v;
    }
    if (sumOfSquares == 0.0) {
      return;
    }
    float norm = (float) Math.sqrt(sumOfSquares);
    for (int i = 0; i < vector.length; i++) {
      vector[i] /= norm;
    }
  }
}
