package com.flamingo.ai.devicerag.vectorstore;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.domain.model.ContentType;
import com.flamingo.ai.devicerag.exception.SearchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * {@link VectorStore} on an Elasticsearch index with a cosine {@code dense_vector} field.
 *
 * <p>The device namespace is stored as a keyword field and every kNN search carries a term filter
 * on it, so isolation is enforced by the index query itself.
 */
@Service
@ConditionalOnProperty(
    name = "rag.vector-store.type",
    havingValue = "elasticsearch",
    matchIfMissing = true)
@Slf4j
public class ElasticsearchVectorStore implements VectorStore {

  private static final String DEVICE_FIELD = "deviceId";
  private static final String EMBEDDING_FIELD = "embedding";

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final int vectorDimensions;

  public ElasticsearchVectorStore(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, RagConfig ragConfig) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = ragConfig.getVectorStore().getIndexName();
    this.vectorDimensions = ragConfig.getVectorStore().getDimensions();
  }

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            indexName);
        return;
      }
      boolean exists = indices.exists(e -> e.index(indexName)).value();
      if (!exists) {
        CreateIndexRequest request =
            CreateIndexRequest.of(
                c ->
                    c.index(indexName)
                        .mappings(
                            m -> m.dynamic(DynamicMapping.False).properties(defineProperties())));
        indices.create(request);
        log.info("Created Elasticsearch index: {}", indexName);
      } else {
        updateAndValidateMappings();
      }
    } catch (IOException e) {
      log.error("Failed to initialize Elasticsearch index '{}': {}", indexName, e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + indexName + "'", e);
    }
  }

  /**
   * Adds missing fields to an existing index and fails fast on type mismatches, which can only be
   * fixed by recreating the index.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expected = defineProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(indexName));
    var indexMapping = response.get(indexName);
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actual = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    Map<String, Property> missing = new HashMap<>();
    for (Map.Entry<String, Property> entry : expected.entrySet()) {
      Property current = actual.get(entry.getKey());
      if (current == null) {
        missing.put(entry.getKey(), entry.getValue());
      } else if (current._kind() != entry.getValue()._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), current._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + indexName
              + "' has incompatible field type(s), delete it and restart: "
              + String.join("; ", mismatches));
    }
    if (!missing.isEmpty()) {
      elasticsearchClient
          .indices()
          .putMapping(PutMappingRequest.of(p -> p.index(indexName).properties(missing)));
      log.info(
          "Added {} new field(s) to index '{}': {}", missing.size(), indexName, missing.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", indexName);
    }
  }

  private Map<String, Property> defineProperties() {
    Map<String, Property> properties = new HashMap<>();
    // documentId and deviceId MUST be keyword type for exact matching
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put(DEVICE_FIELD, Property.of(p -> p.keyword(k -> k)));
    properties.put("filename", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("startOffset", Property.of(p -> p.integer(i -> i)));
    properties.put("endOffset", Property.of(p -> p.integer(i -> i)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("qualityScore", Property.of(p -> p.double_(d -> d)));
    properties.put("importanceScore", Property.of(p -> p.double_(d -> d)));
    properties.put("keywords", Property.of(p -> p.keyword(k -> k)));
    properties.put("contentType", Property.of(p -> p.keyword(k -> k)));
    properties.put(
        EMBEDDING_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  @Timed(value = "vectorstore.upsert", description = "Time to upsert chunk vectors")
  public void upsert(List<VectorRecord> records, String namespace) {
    if (records.isEmpty()) {
      return;
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (VectorRecord record : records) {
        Map<String, Object> document = toDocument(record, namespace);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(indexName).id(record.chunkId()).document(document)));
      }
      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        meterRegistry.counter("vectorstore.upsert.errors").increment();
        throw new SearchException("Bulk upsert reported item errors for namespace " + namespace);
      }
      meterRegistry.counter("vectorstore.upserted").increment(records.size());
      log.debug("Upserted {} vectors into {} for device {}", records.size(), indexName, namespace);
    } catch (IOException e) {
      log.error("Failed to upsert vectors into {}: {}", indexName, e.getMessage(), e);
      throw new SearchException("Failed to upsert vectors", e);
    }
  }

  @Override
  @Timed(value = "vectorstore.query", description = "Time for kNN search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "queryFallback")
  public List<VectorMatch> query(List<Float> embedding, String namespace, int topK) {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("namespace is required for vector search");
    }
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k ->
                            k.field(EMBEDDING_FIELD)
                                .queryVector(embedding)
                                .k(topK)
                                .numCandidates(Math.max(topK * 4, 50))
                                .filter(f -> f.term(t -> t.field(DEVICE_FIELD).value(namespace))))
                    .size(topK));
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<VectorMatch> matches = toMatches(response.hits().hits());
      meterRegistry.counter("vectorstore.query").increment();
      log.debug("kNN search in {} for device {} returned {}", indexName, namespace, matches.size());
      return matches;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", indexName, e.getMessage(), e);
      throw new SearchException("Vector search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<VectorMatch> queryFallback(
      List<Float> embedding, String namespace, int topK, Throwable t) {
    log.warn("Vector search fallback triggered for device {}: {}", namespace, t.getMessage());
    meterRegistry.counter("vectorstore.query.fallback").increment();
    return List.of();
  }

  @Override
  @Timed(value = "vectorstore.delete", description = "Time to delete a document's vectors")
  public void deleteDocument(String documentId, String namespace) {
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(
              d ->
                  d.index(indexName)
                      .query(
                          q ->
                              q.bool(
                                  b ->
                                      b.filter(
                                              f ->
                                                  f.term(
                                                      t -> t.field("documentId").value(documentId)))
                                          .filter(
                                              f ->
                                                  f.term(
                                                      t ->
                                                          t.field(DEVICE_FIELD)
                                                              .value(namespace))))));
      elasticsearchClient.deleteByQuery(request);
      meterRegistry.counter("vectorstore.deleted").increment();
      log.info("Deleted vectors of document {} from device {}", documentId, namespace);
    } catch (IOException e) {
      log.error("Failed to delete vectors of document {}: {}", documentId, e.getMessage(), e);
      throw new SearchException("Failed to delete document vectors", e);
    }
  }

  private Map<String, Object> toDocument(VectorRecord record, String namespace) {
    ChunkMetadata metadata = record.metadata();
    Map<String, Object> document = new HashMap<>();
    document.put("documentId", metadata.documentId());
    document.put(DEVICE_FIELD, namespace);
    document.put("filename", metadata.filename());
    document.put("chunkIndex", metadata.chunkIndex());
    document.put("startOffset", metadata.startOffset());
    document.put("endOffset", metadata.endOffset());
    document.put("content", metadata.content());
    document.put("qualityScore", metadata.qualityScore());
    document.put("importanceScore", metadata.importanceScore());
    document.put("keywords", metadata.keywords());
    document.put("contentType", metadata.contentType().name());
    document.put(EMBEDDING_FIELD, record.embedding());
    return document;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private List<VectorMatch> toMatches(List<Hit<Map>> hits) {
    List<VectorMatch> matches = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source == null) {
        continue;
      }
      ChunkMetadata metadata =
          new ChunkMetadata(
              (String) source.get("documentId"),
              (String) source.get(DEVICE_FIELD),
              (String) source.get("filename"),
              intValue(source.get("chunkIndex")),
              intValue(source.get("startOffset")),
              intValue(source.get("endOffset")),
              (String) source.get("content"),
              doubleValue(source.get("qualityScore")),
              doubleValue(source.get("importanceScore")),
              (List<String>) source.get("keywords"),
              source.get("contentType") == null
                  ? ContentType.TEXT
                  : ContentType.valueOf((String) source.get("contentType")));
      // cosine kNN scores are (1 + cos) / 2
      double score = hit.score() == null ? 0.0 : Math.max(0.0, 2 * hit.score() - 1);
      matches.add(new VectorMatch(hit.id(), Math.min(1.0, score), metadata));
    }
    return matches;
  }

  private static int intValue(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }

  private static double doubleValue(Object value) {
    return value instanceof Number n ? n.doubleValue() : 0.0;
  }
}
