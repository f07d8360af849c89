package com.flamingo.ai.devicerag.service.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.devicerag.domain.model.Document;
import com.flamingo.ai.devicerag.exception.DocumentNotFoundException;
import com.flamingo.ai.devicerag.exception.DocumentProcessingException;
import com.flamingo.ai.devicerag.service.rag.DocumentIngestionService;
import com.flamingo.ai.devicerag.vectorstore.VectorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentServiceImpl Tests")
class DocumentServiceImplTest {

  @Mock private DocumentIngestionService ingestionService;
  @Mock private VectorStore vectorStore;

  private DocumentRegistry registry;
  private SimpleMeterRegistry meterRegistry;
  private DocumentServiceImpl service;

  @BeforeEach
  void setUp() {
    registry = new DocumentRegistry();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new DocumentServiceImpl(
            ingestionService, registry, vectorStore, meterRegistry, Runnable::run);
  }

  private static SourceDocument source(String filename) {
    return new SourceDocument("device-1", filename, "text/plain", new byte[] {65});
  }

  private static Document document(String id, String filename) {
    return new Document(
        id,
        "device-1",
        filename,
        List.of(id + "_0"),
        true,
        0,
        Instant.parse("2026-01-01T00:00:00Z"));
  }

  @Nested
  @DisplayName("Ingestion")
  class Ingestion {

    @Test
    @DisplayName("Should return one outcome per upload and isolate failures")
    void shouldIsolateFailures() {
      Document ok = document("doc-1", "ok.txt");
      when(ingestionService.ingest(argThat(s -> s != null && s.filename().equals("ok.txt"))))
          .thenReturn(ok);
      when(ingestionService.ingest(argThat(s -> s != null && s.filename().equals("bad.pdf"))))
          .thenThrow(new DocumentProcessingException("doc-2", "unreadable"));

      List<DocumentService.IngestionOutcome> outcomes =
          service.ingestAll(List.of(source("ok.txt"), source("bad.pdf")));

      assertThat(outcomes).hasSize(2);
      assertThat(outcomes.get(0).isSuccess()).isTrue();
      assertThat(outcomes.get(0).document()).isEqualTo(ok);
      assertThat(outcomes.get(1).isSuccess()).isFalse();
      assertThat(outcomes.get(1).filename()).isEqualTo("bad.pdf");
      assertThat(outcomes.get(1).error()).hasMessage("unreadable");
      assertThat(meterRegistry.counter("document.upload.failed").count()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Management")
  class Management {

    @Test
    @DisplayName("Should list and get registered documents")
    void shouldListAndGet() {
      Document doc = document("doc-1", "ifu.txt");
      registry.save(doc);

      assertThat(service.listDocuments("device-1")).containsExactly(doc);
      assertThat(service.getDocument("device-1", "doc-1")).isEqualTo(doc);
      assertThat(service.listDocuments("device-2")).isEmpty();
    }

    @Test
    @DisplayName("Should not find a document under another device")
    void shouldScopeByDevice() {
      registry.save(document("doc-1", "ifu.txt"));

      assertThatThrownBy(() -> service.getDocument("device-2", "doc-1"))
          .isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    @DisplayName("Should delete the vectors and the registration")
    void shouldDelete() {
      registry.save(document("doc-1", "ifu.txt"));

      service.deleteDocument("device-1", "doc-1");

      verify(vectorStore).deleteDocument("doc-1", "device-1");
      assertThat(registry.find("device-1", "doc-1")).isEmpty();
    }

    @Test
    @DisplayName("Should not touch the store when deleting an unknown document")
    void shouldRejectUnknownDelete() {
      assertThatThrownBy(() -> service.deleteDocument("device-1", "missing"))
          .isInstanceOf(DocumentNotFoundException.class);
      verifyNoInteractions(vectorStore);
    }
  }
}
