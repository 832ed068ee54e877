package com.flamingo.ai.studyrag.service.rag.index;

import com.flamingo.ai.studyrag.service.rag.embedding.EmbeddingProfile;
import com.flamingo.ai.studyrag.service.rag.model.ScoredRecord;
import com.flamingo.ai.studyrag.service.rag.model.VectorRecord;
import java.util.List;
import java.util.Set;

/**
 * Stores embedded content blocks and answers nearest-neighbour queries.
 *
 * <p>Scores are cosine similarities mapped to {@code [0, 1]} as {@code (1 + cos) / 2}. Results are
 * ordered by descending score; equal scores are ordered by insertion, earliest first. All methods
 * throw {@link com.flamingo.ai.studyrag.exception.IndexUnavailableException} when the backing
 * store cannot be reached.
 */
public interface VectorIndex {

  /**
   * Opens the index for vectors of the given profile, creating it when missing.
   *
   * @throws com.flamingo.ai.studyrag.exception.ConfigException if the index was built with a
   *     different embedding profile
   */
  void initialize(EmbeddingProfile profile);

  /**
   * Inserts or replaces records by id.
   *
   * @param records records to write; each vector must match the index dimensions
   * @return number of records written
   */
  int upsert(List<VectorRecord> records);

  /**
   * Returns the {@code k} records most similar to {@code queryVector}.
   *
   * @param queryVector query embedding
   * @param k maximum number of results
   * @param deckId exact-match deck filter applied before ranking, or {@code null} for all decks
   * @return hits ordered by descending score
   */
  List<ScoredRecord> search(float[] queryVector, int k, String deckId);

  /**
   * Lazily iterates every record of a deck (or of the whole index when {@code deckId} is null) in
   * insertion order. Each call to {@link Iterable#iterator()} starts a fresh, finite scan that
   * fetches records page by page.
   */
  Iterable<VectorRecord> export(String deckId);

  /**
   * Removes records of a source that are not in {@code retainIds}. Used when a source is
   * re-ingested and now yields fewer blocks.
   *
   * @return number of records removed
   */
  long deleteStale(String deckId, String sourceId, Set<String> retainIds);

  /** Number of records in a deck, or in the whole index when {@code deckId} is null. */
  long count(String deckId);
}
