package com.flamingo.ai.ragdocs.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.ragdocs.exception.SchemaException;
import com.flamingo.ai.ragdocs.exception.StorageException;
import com.flamingo.ai.ragdocs.exception.VectorStoreConnectionException;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for Elasticsearch index services.
 *
 * <p>Owns the index lifecycle (create or validate mapping), bulk insert with store-assigned ids,
 * predicate delete and raw search. Subclasses define the mapping and the conversion between
 * entities and documents.
 *
 * <p>Transport failures surface as {@link VectorStoreConnectionException} when the store refused
 * the connection and as {@link StorageException} otherwise. Nothing is retried here.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  private volatile boolean schemaReady;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  public abstract String getIndexName();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  /** Number of primary shards used when the index is created. */
  protected abstract int getShards();

  protected abstract Map<String, Object> convertToDocument(T entity);

  /**
   * Converts an Elasticsearch source map to an entity.
   *
   * @param id the store-assigned document id
   * @param source the document source
   * @return the entity
   */
  protected abstract T convertFromDocument(String id, Map<String, Object> source);

  /**
   * Returns the metric prefix for this index (e.g., "document_chunk").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  /** Pings the cluster. */
  protected void ping() {
    boolean reachable;
    try {
      reachable = elasticsearchClient.ping().value();
    } catch (IOException e) {
      throw new VectorStoreConnectionException(
          "Elasticsearch is unreachable: " + e.getMessage(), e);
    }
    if (!reachable) {
      throw new VectorStoreConnectionException("Elasticsearch did not answer the ping");
    }
    log.info("Elasticsearch connection verified for index {}", getIndexName());
  }

  /** Creates the index if absent, otherwise validates and extends its mapping. */
  protected void initIndex() {
    if (schemaReady) {
      return;
    }
    synchronized (this) {
      if (schemaReady) {
        return;
      }
      try {
        boolean exists = elasticsearchClient.indices().exists(e -> e.index(getIndexName())).value();
        if (!exists) {
          createIndex();
          log.info("Created Elasticsearch index: {}", getIndexName());
        } else {
          updateAndValidateMappings();
        }
        schemaReady = true;
      } catch (IOException e) {
        throw translate("initialize index", e);
      } catch (ElasticsearchException e) {
        throw new SchemaException(
            getIndexName(),
            "Failed to initialize Elasticsearch index '" + getIndexName() + "': " + e.getMessage(),
            e);
      }
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false keeps undeclared fields out of the mapping.
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .settings(s -> s.numberOfShards(String.valueOf(getShards())))
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches.
   *
   * <p>Elasticsearch allows adding new fields via the Put Mapping API but does not allow changing
   * the type of existing fields, so a mismatch requires deleting the index.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual != null && entry.getValue()._kind() != actual._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), actual._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      String message =
          String.format(
              "Index '%s' has incompatible field type(s): %s. "
                  + "Delete the index and sync again to apply correct mappings.",
              getIndexName(), String.join("; ", mismatches));
      log.error(message);
      throw new SchemaException(getIndexName(), message);
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

  /** Bulk-indexes documents without ids, then refreshes the index. */
  protected void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(op -> op.index(idx -> idx.index(getIndexName()).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        List<String> reasons = new ArrayList<>();
        for (BulkResponseItem item : response.items()) {
          if (item.error() != null) {
            reasons.add(item.error().reason());
          }
        }
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        throw new StorageException(
            String.format(
                "%d of %d documents failed to index in %s: %s",
                reasons.size(),
                documents.size(),
                getIndexName(),
                reasons.stream().distinct().limit(3).toList()));
      }
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    } catch (IOException e) {
      throw translate("index documents", e);
    } catch (ElasticsearchException e) {
      throw new StorageException(
          "Failed to index documents to " + getIndexName() + ": " + e.getMessage(), e);
    }
  }

  /**
   * Deletes matching documents and refreshes so the deletion is visible immediately.
   *
   * @return number of deleted documents
   */
  protected long deleteBy(Query query) {
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(query).refresh(true));
      DeleteByQueryResponse response = elasticsearchClient.deleteByQuery(request);
      long deleted = response.deleted() != null ? response.deleted() : 0L;
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment(deleted);
      return deleted;
    } catch (IOException e) {
      throw translate("delete documents", e);
    } catch (ElasticsearchException e) {
      throw new StorageException(
          "Failed to delete documents from " + getIndexName() + ": " + e.getMessage(), e);
    }
  }

  /**
   * Executes a search. A missing index yields no hits, since nothing was ever synced into it.
   *
   * @return hits in the order returned by Elasticsearch
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  protected List<Hit<Map>> executeSearch(SearchRequest request) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<Hit<Map>> hits = response.hits().hits();
      log.debug("[search] index={} returned={}", getIndexName(), hits.size());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return hits;
    } catch (IOException e) {
      throw translate("search", e);
    } catch (ElasticsearchException e) {
      if (e.status() == 404) {
        log.debug("Index {} does not exist yet; returning no hits", getIndexName());
        return List.of();
      }
      throw new StorageException("Search failed for " + getIndexName() + ": " + e.getMessage(), e);
    }
  }

  /** Maps a low-level I/O failure to the storage exception hierarchy. */
  protected StorageException translate(String action, IOException e) {
    log.error("Failed to {} for {}: {}", action, getIndexName(), e.getMessage());
    if (isConnectionFailure(e)) {
      return new VectorStoreConnectionException(
          "Elasticsearch is unreachable (" + action + "): " + e.getMessage(), e);
    }
    return new StorageException(
        "Failed to " + action + " for " + getIndexName() + ": " + e.getMessage(), e);
  }

  private static boolean isConnectionFailure(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof ConnectException) {
        return true;
      }
    }
    return false;
  }
}
