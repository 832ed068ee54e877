package com.flamingo.ai.studyrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import co.elastic.clients.json.JsonData;
import com.flamingo.ai.studyrag.exception.IndexUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for Elasticsearch-backed indexes.
 *
 * <p>Creates the index with an explicit, non-dynamic mapping, adds missing fields to an existing
 * index and fails fast on field type mismatches. Every client failure surfaces as an {@link
 * IndexUnavailableException}; nothing is swallowed.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  public abstract String getIndexName();

  /** Field mappings of the index. */
  protected abstract Map<String, Property> defineIndexProperties();

  /** Index-level {@code _meta} written when the index is created. */
  protected abstract Map<String, JsonData> defineIndexMeta();

  /** Checks the {@code _meta} of an existing index. */
  protected abstract void validateIndexMeta(Map<String, JsonData> actualMeta);

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(String id, Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  /** Metric prefix, e.g. {@code vector_record}. */
  protected abstract String getMetricPrefix();

  /** Creates the index or reconciles the mapping of an existing one. */
  protected void initIndex() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (IOException | ElasticsearchException e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IndexUnavailableException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    Map<String, JsonData> meta = defineIndexMeta();
    // dynamic=false keeps undeclared fields out of the mapping
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(
                        m -> m.dynamic(DynamicMapping.False).meta(meta).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches.
   *
   * <p>Elasticsearch can add fields to a mapping but cannot change the type of an existing field,
   * so mismatches require the index to be recreated manually.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    validateIndexMeta(indexMapping.mappings().meta());
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual != null && entry.getValue()._kind() != actual._kind()) {
        String msg =
            String.format(
                "Mapping mismatch in index '%s': field '%s' expected type '%s' but found '%s'. "
                    + "Delete the index and restart the application to apply correct mappings.",
                getIndexName(), entry.getKey(), entry.getValue()._kind(), actual._kind());
        log.error(msg);
        mismatches.add(msg);
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s). "
              + String.join("; ", mismatches));
    }

    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      if (!actualProperties.containsKey(entry.getKey())) {
        missingFields.put(entry.getKey(), entry.getValue());
      }
    }
    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  /** Bulk-indexes documents, waiting until they are visible to search. */
  protected void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        throw new IndexUnavailableException(
            "Some documents failed to index in " + getIndexName() + ": " + response.items());
      }
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexUnavailableException("Failed to index documents", e);
    }
  }

  /** Runs a search and maps hits to (document, score) pairs in response order. */
  @SuppressWarnings({"unchecked", "rawtypes"})
  protected List<ScoredHit<T>> executeSearch(SearchRequest request, String searchType) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<ScoredHit<T>> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        Map<String, Object> source = hit.source();
        if (source != null) {
          double score = hit.score() != null ? hit.score() : 0.0;
          results.add(
              new ScoredHit<>(
                  convertFromDocument(hit.id(), source), score, hit.sort(), source));
        }
      }
      log.debug("[{}] index={} returned={}", searchType, getIndexName(), results.size());
      meterRegistry.counter(getMetricPrefix() + "." + searchType).increment();
      return results;
    } catch (IOException | ElasticsearchException e) {
      log.error("{} failed for {}: {}", searchType, getIndexName(), e.getMessage(), e);
      throw new IndexUnavailableException(searchType + " failed", e);
    }
  }

  /** Deletes documents matching the query and returns how many were removed. */
  protected long deleteBy(Query deleteQuery) {
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(deleteQuery).refresh(true));
      Long deleted = elasticsearchClient.deleteByQuery(request).deleted();
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
      return deleted == null ? 0 : deleted;
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to delete documents from {}: {}", getIndexName(), e.getMessage(), e);
      throw new IndexUnavailableException("Failed to delete documents", e);
    }
  }

  protected long countBy(Query query) {
    try {
      return elasticsearchClient.count(c -> c.index(getIndexName()).query(query)).count();
    } catch (IOException | ElasticsearchException e) {
      throw new IndexUnavailableException("Failed to count documents in " + getIndexName(), e);
    }
  }

  /**
   * A search hit.
   *
   * @param document converted document
   * @param score relevance score
   * @param sort sort values, used as the cursor for the next page
   * @param source raw {@code _source} of the hit
   */
  protected record ScoredHit<T>(
      T document, double score, List<FieldValue> sort, Map<String, Object> source) {}
}
