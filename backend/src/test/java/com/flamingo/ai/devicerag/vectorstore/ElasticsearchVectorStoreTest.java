package com.flamingo.ai.devicerag.vectorstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.core.search.HitsMetadata;
import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.domain.model.ContentType;
import com.flamingo.ai.devicerag.exception.SearchException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ElasticsearchVectorStore Tests")
@SuppressWarnings({"unchecked", "rawtypes"})
class ElasticsearchVectorStoreTest {

  @Mock private ElasticsearchClient elasticsearchClient;

  private SimpleMeterRegistry meterRegistry;
  private ElasticsearchVectorStore store;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    store = new ElasticsearchVectorStore(elasticsearchClient, meterRegistry, new RagConfig());
  }

  private static Map<String, Object> source(String documentId) {
    Map<String, Object> source = new HashMap<>();
    source.put("documentId", documentId);
    source.put("deviceId", "device-1");
    source.put("filename", "cert.pdf");
    source.put("chunkIndex", 2);
    source.put("startOffset", 100);
    source.put("endOffset", 400);
    source.put("content", "Manufacturer: Acme Medical");
    source.put("qualityScore", 0.8);
    source.put("importanceScore", 0.6);
    source.put("keywords", List.of("manufacturer"));
    source.put("contentType", "FORM");
    return source;
  }

  private void stubSearch(List<Hit<Map>> hits) throws IOException {
    SearchResponse<Map> response = mock(SearchResponse.class);
    HitsMetadata<Map> metadata = mock(HitsMetadata.class);
    when(metadata.hits()).thenReturn(hits);
    when(response.hits()).thenReturn(metadata);
    when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
        .thenReturn(response);
  }

  @Nested
  @DisplayName("query")
  class Query {

    @Test
    @DisplayName("should convert kNN scores back to cosine similarity")
    void shouldConvertScores() throws IOException {
      stubSearch(
          List.of(
              Hit.<Map>of(h -> h.index("device-chunks").id("c1").score(0.95).source(source("d1"))),
              Hit.<Map>of(h -> h.index("device-chunks").id("c2").score(0.3).source(source("d1")))));

      List<VectorMatch> matches = store.query(List.of(0.1f, 0.2f), "device-1", 5);

      assertThat(matches).extracting(VectorMatch::chunkId).containsExactly("c1", "c2");
      assertThat(matches.get(0).score()).isCloseTo(0.9, offset(1e-9));
      assertThat(matches.get(1).score()).isZero();
      ChunkMetadata metadata = matches.get(0).metadata();
      assertThat(metadata.chunkIndex()).isEqualTo(2);
      assertThat(metadata.contentType()).isEqualTo(ContentType.FORM);
      assertThat(metadata.keywords()).containsExactly("manufacturer");
    }

    @Test
    @DisplayName("should filter the kNN search by device")
    void shouldFilterByDevice() throws IOException {
      stubSearch(List.of());

      store.query(List.of(0.1f), "device-1", 5);

      ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
      verify(elasticsearchClient).search(request.capture(), eq(Map.class));
      var knn = request.getValue().knn().get(0);
      assertThat(knn.k()).isEqualTo(5);
      assertThat(knn.filter().get(0).term().field()).isEqualTo("deviceId");
      assertThat(knn.filter().get(0).term().value().stringValue()).isEqualTo("device-1");
    }

    @Test
    @DisplayName("should skip hits without a source")
    void shouldSkipHitsWithoutSource() throws IOException {
      stubSearch(List.of(Hit.<Map>of(h -> h.index("device-chunks").id("c1").score(0.9))));

      assertThat(store.query(List.of(0.1f), "device-1", 5)).isEmpty();
    }

    @Test
    @DisplayName("should require a namespace")
    void shouldRequireNamespace() {
      assertThatThrownBy(() -> store.query(List.of(0.1f), " ", 5))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(elasticsearchClient);
    }

    @Test
    @DisplayName("should wrap transport failures")
    void shouldWrapTransportFailures() throws IOException {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(new IOException("connection refused"));

      assertThatThrownBy(() -> store.query(List.of(0.1f), "device-1", 5))
          .isInstanceOf(SearchException.class);
    }
  }

  @Nested
  @DisplayName("upsert")
  class Upsert {

    private VectorRecord record() {
      return new VectorRecord(
          "c1",
          List.of(0.1f, 0.2f),
          new ChunkMetadata(
              "d1", "device-1", "cert.pdf", 0, 0, 20, "Manufacturer: Acme", 0.9, 0.5, List.of(),
              ContentType.TEXT));
    }

    @Test
    @DisplayName("should skip an empty batch")
    void shouldSkipEmptyBatch() {
      store.upsert(List.of(), "device-1");

      verifyNoInteractions(elasticsearchClient);
    }

    @Test
    @DisplayName("should index records and count them")
    void shouldIndexRecords() throws IOException {
      BulkResponse response = mock(BulkResponse.class);
      when(response.errors()).thenReturn(false);
      when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(response);

      store.upsert(List.of(record()), "device-1");

      ArgumentCaptor<BulkRequest> request = ArgumentCaptor.forClass(BulkRequest.class);
      verify(elasticsearchClient).bulk(request.capture());
      assertThat(request.getValue().operations()).hasSize(1);
      assertThat(request.getValue().operations().get(0).index().id()).isEqualTo("c1");
      assertThat(meterRegistry.counter("vectorstore.upserted").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should fail when the bulk response reports item errors")
    void shouldFailOnItemErrors() throws IOException {
      BulkResponse response = mock(BulkResponse.class);
      when(response.errors()).thenReturn(true);
      when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(response);

      assertThatThrownBy(() -> store.upsert(List.of(record()), "device-1"))
          .isInstanceOf(SearchException.class);
      assertThat(meterRegistry.counter("vectorstore.upsert.errors").count()).isEqualTo(1.0);
    }
  }
}
