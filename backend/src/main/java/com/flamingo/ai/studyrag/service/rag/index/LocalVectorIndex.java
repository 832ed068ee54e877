package com.flamingo.ai.studyrag.service.rag.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.studyrag.exception.ConfigException;
import com.flamingo.ai.studyrag.exception.IndexUnavailableException;
import com.flamingo.ai.studyrag.service.rag.embedding.EmbeddingProfile;
import com.flamingo.ai.studyrag.service.rag.model.ScoredRecord;
import com.flamingo.ai.studyrag.service.rag.model.VectorRecord;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Embedded {@link VectorIndex} that keeps vectors in memory and optionally persists them to a
 * {@link VectorRecordJournal}.
 *
 * <p>Writes to the same id are serialised by {@link ConcurrentHashMap#compute}, so the last writer
 * wins and the journal sees writes in the same order as the map. Writes to different ids and
 * searches run concurrently; a search sees a weakly consistent snapshot of the entries.
 *
 * <p>Each record carries two sequence numbers: the latest write, used to break score ties, and the
 * first insertion, kept across re-upserts and used for export order.
 */
@Slf4j
public class LocalVectorIndex implements VectorIndex {

  private static final Comparator<Entry> WORST_FIRST =
      Comparator.comparingDouble(Entry::score).thenComparing(Entry::seq, Comparator.reverseOrder());

  private final Map<String, StoredRecord> records = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final VectorRecordJournal journal;
  private final int exportPageSize;
  private final MeterRegistry meterRegistry;
  private volatile EmbeddingProfile profile;

  /**
   * Creates the index.
   *
   * @param storagePath journal file, or {@code null} for a purely in-memory index
   * @param objectMapper mapper used for journal lines
   * @param exportPageSize records fetched per export page
   * @param meterRegistry metrics registry
   */
  public LocalVectorIndex(
      Path storagePath,
      ObjectMapper objectMapper,
      int exportPageSize,
      MeterRegistry meterRegistry) {
    this.journal = storagePath == null ? null : new VectorRecordJournal(storagePath, objectMapper);
    this.exportPageSize = exportPageSize;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public synchronized void initialize(EmbeddingProfile expected) {
    this.profile = expected;
    if (journal == null) {
      log.info("Local vector index running in memory for profile {}", expected.describe());
      return;
    }
    try {
      if (journal.exists()) {
        replayJournal(expected);
      } else {
        journal.append(VectorRecordJournal.Entry.profile(expected.describe()));
        journal.flush();
        log.info("Created local vector index journal at {}", journal.path());
      }
    } catch (IOException | UncheckedIOException e) {
      throw new IndexUnavailableException(
          "Failed to open local vector index at " + journal.path(), e);
    }
  }

  private void replayJournal(EmbeddingProfile expected) throws IOException {
    records.clear();
    long[] applied = new long[1];
    journal.replay(
        entry -> {
          switch (entry.op()) {
            case VectorRecordJournal.OP_PROFILE ->
                expected.requireCompatible(
                    EmbeddingProfile.parse(entry.profile()),
                    "Local vector index " + journal.path());
            case VectorRecordJournal.OP_UPSERT -> {
              records.compute(entry.id(), (id, previous) -> store(entry.toRecord(), previous));
              applied[0]++;
            }
            case VectorRecordJournal.OP_DELETE -> records.remove(entry.id());
            default -> log.warn("Skipping unknown journal operation '{}'", entry.op());
          }
        });
    log.info(
        "Loaded local vector index from {}: {} live records ({} upserts replayed)",
        journal.path(),
        records.size(),
        applied[0]);
  }

  @Override
  @Timed(value = "vector_index.upsert", description = "Time to upsert vector records")
  public int upsert(List<VectorRecord> batch) {
    EmbeddingProfile current = requireInitialized();
    for (VectorRecord record : batch) {
      if (record.dimensions() != current.dimensions()) {
        throw new ConfigException(
            "rag.embedding.dimensions",
            String.format(
                "Record %s has %d dimensions but the index stores %d",
                record.id(), record.dimensions(), current.dimensions()));
      }
    }

    try {
      for (VectorRecord record : batch) {
        records.compute(
            record.id(),
            (id, previous) -> {
              appendToJournal(VectorRecordJournal.Entry.upsert(record));
              return store(record, previous);
            });
      }
      flushJournal();
    } catch (UncheckedIOException e) {
      log.error("Failed to append upserts to {}: {}", journal.path(), e.getMessage(), e);
      throw new IndexUnavailableException("Failed to persist vector records", e.getCause());
    }
    meterRegistry.counter("vector_index.upserted").increment(batch.size());
    return batch.size();
  }

  @Override
  @Timed(value = "vector_index.search", description = "Time for vector search")
  public List<ScoredRecord> search(float[] queryVector, int k, String deckId) {
    EmbeddingProfile current = requireInitialized();
    if (queryVector.length != current.dimensions()) {
      throw new ConfigException(
          "rag.embedding.dimensions",
          String.format(
              "Query vector has %d dimensions but the index stores %d",
              queryVector.length, current.dimensions()));
    }
    if (k <= 0) {
      return List.of();
    }

    PriorityQueue<Entry> best = new PriorityQueue<>(k + 1, WORST_FIRST);
    for (StoredRecord stored : records.values()) {
      if (deckId != null && !deckId.equals(stored.record().deckId())) {
        continue;
      }
      best.add(
          new Entry(stored, VectorMath.score(queryVector, stored.vector()), stored.seq()));
      if (best.size() > k) {
        best.poll();
      }
    }

    List<Entry> ranked = new ArrayList<>(best);
    ranked.sort(WORST_FIRST.reversed());
    List<ScoredRecord> hits = new ArrayList<>(ranked.size());
    for (Entry entry : ranked) {
      hits.add(new ScoredRecord(entry.stored().record(), entry.score()));
    }
    meterRegistry.counter("vector_index.search").increment();
    log.debug("Local search deck={} k={} returned {} hits", deckId, k, hits.size());
    return hits;
  }

  @Override
  public Iterable<VectorRecord> export(String deckId) {
    requireInitialized();
    return () -> new ExportIterator(deckId, sequence.get());
  }

  @Override
  public long deleteStale(String deckId, String sourceId, Set<String> retainIds) {
    requireInitialized();
    long removed = 0;
    try {
      for (StoredRecord stored : records.values()) {
        VectorRecord record = stored.record();
        if (Objects.equals(deckId, record.deckId())
            && Objects.equals(sourceId, record.payload().sourceId())
            && !retainIds.contains(record.id())
            && records.remove(record.id(), stored)) {
          appendToJournal(VectorRecordJournal.Entry.delete(record.id()));
          removed++;
        }
      }
      flushJournal();
    } catch (UncheckedIOException e) {
      log.error("Failed to append deletes to {}: {}", journal.path(), e.getMessage(), e);
      throw new IndexUnavailableException("Failed to persist vector record deletion", e.getCause());
    }
    if (removed > 0) {
      log.info("Removed {} stale records of source {} in deck {}", removed, sourceId, deckId);
    }
    return removed;
  }

  @Override
  public long count(String deckId) {
    if (deckId == null) {
      return records.size();
    }
    return records.values().stream().filter(s -> deckId.equals(s.record().deckId())).count();
  }

  private EmbeddingProfile requireInitialized() {
    EmbeddingProfile current = profile;
    if (current == null) {
      throw new IllegalStateException("Local vector index has not been initialized");
    }
    return current;
  }

  /** Closes the journal writer. The index stays readable; a later write reopens the journal. */
  public void close() {
    if (journal == null) {
      return;
    }
    try {
      journal.close();
    } catch (IOException e) {
      throw new IndexUnavailableException(
          "Failed to close local vector index journal " + journal.path(), e);
    }
  }

  private StoredRecord store(VectorRecord record, StoredRecord previous) {
    long seq = sequence.incrementAndGet();
    long inserted = previous == null ? seq : previous.inserted();
    return new StoredRecord(record, record.vector(), seq, inserted);
  }

  private void flushJournal() {
    if (journal == null) {
      return;
    }
    try {
      journal.flush();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void appendToJournal(VectorRecordJournal.Entry entry) {
    if (journal == null) {
      return;
    }
    try {
      journal.append(entry);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Stored record with a private copy of its vector.
   *
   * @param seq sequence of the latest write
   * @param inserted sequence of the first insertion, unchanged by re-upserts
   */
  private record StoredRecord(VectorRecord record, float[] vector, long seq, long inserted) {}

  private record Entry(StoredRecord stored, double score, long seq) {}

  /**
   * Pages through records in first-insertion order, holding at most one page in memory. Records
   * first inserted after the scan started are not visited; records re-upserted during the scan are
   * visited once, with their latest content.
   */
  private final class ExportIterator implements Iterator<VectorRecord> {

    private final String deckId;
    private final long upperBound;
    private long cursor;
    private Iterator<StoredRecord> page = List.<StoredRecord>of().iterator();
    private boolean exhausted;

    private ExportIterator(String deckId, long upperBound) {
      this.deckId = deckId;
      this.upperBound = upperBound;
    }

    @Override
    public boolean hasNext() {
      if (!page.hasNext() && !exhausted) {
        fetchPage();
      }
      return page.hasNext();
    }

    @Override
    public VectorRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      StoredRecord stored = page.next();
      cursor = stored.inserted();
      return stored.record();
    }

    private void fetchPage() {
      PriorityQueue<StoredRecord> window =
          new PriorityQueue<>(
              exportPageSize + 1, Comparator.comparingLong(StoredRecord::inserted).reversed());
      for (StoredRecord stored : records.values()) {
        if (stored.inserted() <= cursor || stored.inserted() > upperBound) {
          continue;
        }
        if (deckId != null && !deckId.equals(stored.record().deckId())) {
          continue;
        }
        window.add(stored);
        if (window.size() > exportPageSize) {
          window.poll();
        }
      }
      List<StoredRecord> ordered = new ArrayList<>(window);
      ordered.sort(Comparator.comparingLong(StoredRecord::inserted));
      exhausted = ordered.size() < exportPageSize;
      page = ordered.iterator();
    }
  }
}
