package com.flamingo.ai.studyrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.json.JsonData;
import com.flamingo.ai.studyrag.exception.ConfigException;
import com.flamingo.ai.studyrag.service.rag.embedding.EmbeddingProfile;
import com.flamingo.ai.studyrag.service.rag.index.VectorIndex;
import com.flamingo.ai.studyrag.service.rag.model.ScoredRecord;
import com.flamingo.ai.studyrag.service.rag.model.VectorRecord;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link VectorIndex} backed by an Elasticsearch {@code dense_vector} field.
 *
 * <p>Search is a filtered kNN query, so the deck filter is applied while candidates are collected
 * and {@code k} hits come from inside the deck. Elasticsearch reports cosine scores as {@code (1 +
 * cos) / 2}. Each write stamps a monotonically increasing {@code seq} used to break score ties and
 * to page exports with {@code search_after}.
 */
@Slf4j
public class ElasticsearchVectorIndex extends AbstractElasticsearchIndexService<VectorRecord>
    implements VectorIndex {

  static final String META_PROFILE = "embedding_profile";
  static final String FIELD_VECTOR = "vector";
  static final String FIELD_SEQ = "seq";

  private static final int MIN_NUM_CANDIDATES = 100;

  private final String indexName;
  private final int exportPageSize;
  private final AtomicLong sequence = new AtomicLong(System.currentTimeMillis() * 1000);
  private volatile EmbeddingProfile profile;

  public ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int exportPageSize) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.exportPageSize = exportPageSize;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  public void initialize(EmbeddingProfile expected) {
    this.profile = expected;
    initIndex();
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // deckId and sourceId MUST be keyword type for exact matching
    properties.put("deckId", Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceId", Property.of(p -> p.keyword(k -> k)));
    properties.put("position", Property.of(p -> p.integer(i -> i)));
    properties.put("tokenCount", Property.of(p -> p.integer(i -> i)));
    properties.put("text", Property.of(p -> p.text(t -> t)));
    properties.put(FIELD_SEQ, Property.of(p -> p.long_(l -> l)));
    properties.put(
        FIELD_VECTOR,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(requireProfile().dimensions())
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, JsonData> defineIndexMeta() {
    return Map.of(META_PROFILE, JsonData.of(requireProfile().describe()));
  }

  @Override
  protected void validateIndexMeta(Map<String, JsonData> actualMeta) {
    JsonData stored = actualMeta == null ? null : actualMeta.get(META_PROFILE);
    if (stored == null) {
      throw new ConfigException(
          "rag.index.index-name",
          "Index '" + indexName + "' has no embedding profile; it was not created by this service");
    }
    requireProfile()
        .requireCompatible(
            EmbeddingProfile.parse(stored.to(String.class)), "Elasticsearch index " + indexName);
  }

  @Override
  protected Map<String, Object> convertToDocument(VectorRecord record) {
    Map<String, Object> document = new HashMap<>();
    document.put("deckId", record.deckId());
    document.put("sourceId", record.payload().sourceId());
    document.put("position", record.payload().position());
    document.put("tokenCount", record.payload().tokenCount());
    document.put("text", record.payload().text());
    document.put(FIELD_SEQ, sequence.incrementAndGet());
    document.put(FIELD_VECTOR, toFloatList(record.vector()));
    return document;
  }

  @Override
  protected VectorRecord convertFromDocument(String id, Map<String, Object> source) {
    return new VectorRecord(
        id,
        (String) source.get("deckId"),
        toFloatArray(source.get(FIELD_VECTOR)),
        new VectorRecord.Payload(
            (String) source.get("text"),
            (String) source.get("sourceId"),
            intValue(source.get("position")),
            intValue(source.get("tokenCount"))));
  }

  @Override
  protected String getDocumentId(VectorRecord record) {
    return record.id();
  }

  @Override
  protected String getMetricPrefix() {
    return "vector_record";
  }

  @Override
  @Timed(value = "vector_index.upsert", description = "Time to upsert vector records")
  public int upsert(List<VectorRecord> records) {
    int dimensions = requireProfile().dimensions();
    for (VectorRecord record : records) {
      if (record.dimensions() != dimensions) {
        throw new ConfigException(
            "rag.embedding.dimensions",
            String.format(
                "Record %s has %d dimensions but index '%s' stores %d",
                record.id(), record.dimensions(), indexName, dimensions));
      }
    }
    indexDocuments(records);
    return records.size();
  }

  @Override
  @Timed(value = "vector_index.search", description = "Time for vector search")
  public List<ScoredRecord> search(float[] queryVector, int k, String deckId) {
    if (k <= 0) {
      return List.of();
    }
    List<ScoredHit<VectorRecord>> hits =
        executeSearch(buildVectorSearchRequest(queryVector, k, deckId), "vector_search");
    return rank(hits);
  }

  @VisibleForTesting
  SearchRequest buildVectorSearchRequest(float[] queryVector, int k, String deckId) {
    List<Float> embedding = toFloatList(queryVector);
    int numCandidates = Math.max(k * 10, MIN_NUM_CANDIDATES);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    knn -> {
                      knn.field(FIELD_VECTOR)
                          .queryVector(embedding)
                          .k(k)
                          .numCandidates(numCandidates);
                      if (deckId != null) {
                        knn.filter(deckFilter(deckId));
                      }
                      return knn;
                    })
                .size(k));
  }

  /** Orders hits by descending score, then by ascending write sequence. */
  @VisibleForTesting
  static List<ScoredRecord> rank(List<ScoredHit<VectorRecord>> hits) {
    List<ScoredHit<VectorRecord>> ordered = new ArrayList<>(hits);
    ordered.sort(
        Comparator.comparingDouble((ScoredHit<VectorRecord> h) -> h.score())
            .reversed()
            .thenComparingLong(ElasticsearchVectorIndex::sequenceOf));
    List<ScoredRecord> ranked = new ArrayList<>(ordered.size());
    for (ScoredHit<VectorRecord> hit : ordered) {
      ranked.add(new ScoredRecord(hit.document(), hit.score()));
    }
    return ranked;
  }

  @Override
  public Iterable<VectorRecord> export(String deckId) {
    requireProfile();
    return () -> new ExportIterator(deckId);
  }

  @Override
  public long deleteStale(String deckId, String sourceId, Set<String> retainIds) {
    List<String> retained = new ArrayList<>(retainIds);
    Query query =
        Query.of(
            q ->
                q.bool(
                    b -> {
                      b.filter(deckFilter(deckId))
                          .filter(f -> f.term(t -> t.field("sourceId").value(sourceId)));
                      if (!retained.isEmpty()) {
                        b.mustNot(mn -> mn.ids(i -> i.values(retained)));
                      }
                      return b;
                    }));
    long deleted = deleteBy(query);
    if (deleted > 0) {
      log.info("Removed {} stale records of source {} in deck {}", deleted, sourceId, deckId);
    }
    return deleted;
  }

  @Override
  public long count(String deckId) {
    return countBy(deckId == null ? Query.of(q -> q.matchAll(m -> m)) : deckFilter(deckId));
  }

  private EmbeddingProfile requireProfile() {
    EmbeddingProfile current = profile;
    if (current == null) {
      throw new IllegalStateException("Elasticsearch vector index has not been initialized");
    }
    return current;
  }

  private static Query deckFilter(String deckId) {
    return Query.of(q -> q.term(t -> t.field("deckId").value(deckId)));
  }

  private static long sequenceOf(ScoredHit<VectorRecord> hit) {
    Object seq = hit.source() == null ? null : hit.source().get(FIELD_SEQ);
    return seq instanceof Number n ? n.longValue() : Long.MAX_VALUE;
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  private static float[] toFloatArray(Object value) {
    if (!(value instanceof List<?> list)) {
      return new float[0];
    }
    float[] vector = new float[list.size()];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = ((Number) list.get(i)).floatValue();
    }
    return vector;
  }

  private static int intValue(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }

  /** Pages through the index with {@code search_after} on the write sequence. */
  private final class ExportIterator implements Iterator<VectorRecord> {

    private final String deckId;
    private Iterator<ScoredHit<VectorRecord>> page = List.<ScoredHit<VectorRecord>>of().iterator();
    private List<FieldValue> cursor;
    private boolean exhausted;

    private ExportIterator(String deckId) {
      this.deckId = deckId;
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
      ScoredHit<VectorRecord> hit = page.next();
      cursor = hit.sort();
      return hit.document();
    }

    private void fetchPage() {
      Query filter = deckId == null ? Query.of(q -> q.matchAll(m -> m)) : deckFilter(deckId);
      List<FieldValue> after = cursor;
      SearchRequest request =
          SearchRequest.of(
              s -> {
                s.index(indexName)
                    .query(filter)
                    .size(exportPageSize)
                    .sort(so -> so.field(f -> f.field(FIELD_SEQ).order(SortOrder.Asc)));
                if (after != null && !after.isEmpty()) {
                  s.searchAfter(after);
                }
                return s;
              });
      List<ScoredHit<VectorRecord>> hits = executeSearch(request, "export");
      exhausted = hits.size() < exportPageSize;
      page = hits.iterator();
    }
  }
}
