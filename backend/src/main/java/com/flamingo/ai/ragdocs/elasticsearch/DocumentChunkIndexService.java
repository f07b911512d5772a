package com.flamingo.ai.ragdocs.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorIndexOptionsType;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.ragdocs.config.RagConfig;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for {@link DocumentChunk} documents.
 *
 * <p>The embedding is a {@code dense_vector} with {@code l2_norm} similarity and an HNSW graph.
 * For that similarity Elasticsearch scores a hit as {@code 1 / (1 + d²)}, where {@code d²} is the
 * squared Euclidean distance, so the distance is recovered from the score.
 */
@Service
@Slf4j
public class DocumentChunkIndexService extends AbstractElasticsearchIndexService<DocumentChunk>
    implements ChunkIndexOperations {

  static final String EMBEDDING_FIELD = "embedding";
  static final String FILE_PATH_FIELD = "filePath";

  private static final List<String> SOURCE_FIELDS =
      List.of(
          "content",
          SearchFilter.TECHNOLOGY_FIELD,
          FILE_PATH_FIELD,
          "fileHash",
          "sectionTitle",
          "sectionLevel",
          SearchFilter.CATEGORY_FIELD);

  private final String indexName;
  private final int vectorDimensions;
  private final int shards;
  private final int hnswM;
  private final int hnswEfConstruction;
  private final int searchBreadth;

  @Autowired
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, RagConfig ragConfig) {
    this(elasticsearchClient, meterRegistry, ragConfig.getIndex());
  }

  /** Constructor for testing - allows passing index settings directly. */
  @VisibleForTesting
  DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, RagConfig.Index index) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = index.getName();
    this.vectorDimensions = index.getVectorDimensions();
    this.shards = index.getShards();
    this.hnswM = index.getHnswM();
    this.hnswEfConstruction = index.getHnswEfConstruction();
    this.searchBreadth = index.getSearchBreadth();
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected int getShards() {
    return shards;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // Filterable fields must be keyword for exact terms matching
    properties.put(SearchFilter.TECHNOLOGY_FIELD, Property.of(p -> p.keyword(k -> k)));
    properties.put(FILE_PATH_FIELD, Property.of(p -> p.keyword(k -> k)));
    properties.put("fileHash", Property.of(p -> p.keyword(k -> k)));
    properties.put(SearchFilter.CATEGORY_FIELD, Property.of(p -> p.keyword(k -> k)));
    properties.put("content", Property.of(p -> p.text(t -> t)));
    properties.put("sectionTitle", Property.of(p -> p.text(t -> t)));
    properties.put("sectionLevel", Property.of(p -> p.short_(s -> s)));
    properties.put(
        EMBEDDING_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.L2Norm)
                                .indexOptions(
                                    o ->
                                        o.type(DenseVectorIndexOptionsType.Hnsw)
                                            .m(hnswM)
                                            .efConstruction(hnswEfConstruction))))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(DocumentChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("content", chunk.getContent());
    document.put(SearchFilter.TECHNOLOGY_FIELD, chunk.getTechnology());
    document.put(FILE_PATH_FIELD, chunk.getFilePath());
    document.put("fileHash", chunk.getFileHash());
    document.put("sectionTitle", chunk.getSectionTitle());
    document.put("sectionLevel", chunk.getSectionLevel());
    document.put(SearchFilter.CATEGORY_FIELD, chunk.getCategory());
    document.put(EMBEDDING_FIELD, chunk.getEmbedding());
    return document;
  }

  @Override
  protected DocumentChunk convertFromDocument(String id, Map<String, Object> source) {
    Object level = source.get("sectionLevel");
    return DocumentChunk.builder()
        .id(id)
        .content((String) source.get("content"))
        .technology((String) source.get(SearchFilter.TECHNOLOGY_FIELD))
        .filePath((String) source.get(FILE_PATH_FIELD))
        .fileHash((String) source.get("fileHash"))
        .sectionTitle((String) source.get("sectionTitle"))
        .sectionLevel(level instanceof Number n ? n.intValue() : 0)
        .category((String) source.get(SearchFilter.CATEGORY_FIELD))
        .build();
  }

  @Override
  protected String getMetricPrefix() {
    return "document_chunk";
  }

  @Override
  public void verifyConnection() {
    ping();
  }

  @Override
  @Timed(value = "elasticsearch.ensure_schema", description = "Time to create or verify index")
  @CircuitBreaker(name = "elasticsearch")
  public void ensureSchema() {
    initIndex();
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete chunks by file path")
  @CircuitBreaker(name = "elasticsearch")
  public long deleteByFilePaths(Set<String> filePaths) {
    if (filePaths.isEmpty()) {
      return 0;
    }
    long deleted = deleteBy(buildDeleteQuery(filePaths));
    log.info("Deleted {} chunks from {} for {} file(s)", deleted, indexName, filePaths.size());
    return deleted;
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index chunks")
  @CircuitBreaker(name = "elasticsearch")
  public void insert(List<DocumentChunk> chunks) {
    indexDocuments(chunks);
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch")
  @SuppressWarnings({"unchecked", "rawtypes"})
  public List<ChunkHit> search(List<Float> queryVector, SearchFilter filter, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<ChunkHit> results = new ArrayList<>();
    for (Hit<Map> hit : executeSearch(buildVectorSearchRequest(queryVector, filter, limit))) {
      Map<String, Object> source = hit.source();
      if (source == null || hit.score() == null) {
        continue;
      }
      DocumentChunk chunk = convertFromDocument(hit.id(), source);
      results.add(new ChunkHit(chunk, distanceFromScore(hit.score())));
    }
    return results;
  }

  @VisibleForTesting
  SearchRequest buildVectorSearchRequest(List<Float> queryVector, SearchFilter filter, int limit) {
    log.debug(
        "vectorSearch index={} limit={} filter={}",
        indexName,
        limit,
        filter.toExpression().orElse("<none>"));
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k -> {
                      k.field(EMBEDDING_FIELD)
                          .queryVector(queryVector)
                          .k(limit)
                          .numCandidates(Math.max(searchBreadth, limit));
                      filter.toQuery().ifPresent(q -> k.filter(q));
                      return k;
                    })
                .source(src -> src.filter(f -> f.includes(SOURCE_FIELDS)))
                .size(limit));
  }

  @VisibleForTesting
  static Query buildDeleteQuery(Set<String> filePaths) {
    List<FieldValue> values = filePaths.stream().map(FieldValue::of).toList();
    return Query.of(q -> q.terms(t -> t.field(FILE_PATH_FIELD).terms(v -> v.value(values))));
  }

  /** Inverts the l2_norm score {@code 1 / (1 + d²)}. */
  @VisibleForTesting
  static double distanceFromScore(double score) {
    if (score <= 0) {
      return Double.MAX_VALUE;
    }
    return Math.max(0.0, 1.0 / score - 1.0);
  }
}
