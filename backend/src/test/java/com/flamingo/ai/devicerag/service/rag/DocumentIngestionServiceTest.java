package com.flamingo.ai.devicerag.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.devicerag.domain.model.Chunk;
import com.flamingo.ai.devicerag.domain.model.ContentType;
import com.flamingo.ai.devicerag.domain.model.Document;
import com.flamingo.ai.devicerag.exception.DocumentProcessingException;
import com.flamingo.ai.devicerag.service.document.DocumentRegistry;
import com.flamingo.ai.devicerag.service.document.SourceDocument;
import com.flamingo.ai.devicerag.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.devicerag.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.devicerag.service.rag.model.ChunkingResult;
import com.flamingo.ai.devicerag.service.rag.model.ExtractedText;
import com.flamingo.ai.devicerag.service.rag.parsing.TikaTextExtractor;
import com.flamingo.ai.devicerag.vectorstore.VectorRecord;
import com.flamingo.ai.devicerag.vectorstore.VectorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentIngestionService Tests")
class DocumentIngestionServiceTest {

  private static final Instant NOW = Instant.parse("2026-02-01T08:00:00Z");
  private static final String TEXT = "Generic name: Pulse Oximeter\nManufacturer: Acme Medical";

  @Mock private DocumentChunker documentChunker;
  @Mock private EmbeddingService embeddingService;
  @Mock private VectorStore vectorStore;

  private DocumentRegistry registry;
  private SimpleMeterRegistry meterRegistry;
  private DocumentIngestionService service;

  @BeforeEach
  void setUp() {
    registry = new DocumentRegistry();
    meterRegistry = new SimpleMeterRegistry();
    service =
        new DocumentIngestionService(
            new TikaTextExtractor(),
            documentChunker,
            embeddingService,
            vectorStore,
            registry,
            meterRegistry,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static SourceDocument source(String filename, String text) {
    return new SourceDocument(
        "device-1", filename, "text/plain", text.getBytes(StandardCharsets.UTF_8));
  }

  private static Chunk chunk(String documentId, int index, String text) {
    return new Chunk(
        Chunk.idFor(documentId, index),
        documentId,
        "device-1",
        index,
        0,
        text.length(),
        text,
        0.9,
        0.6,
        List.of("oximeter"),
        0.1,
        ContentType.TEXT);
  }

  private void chunksFor(String documentId, int rejected, Chunk... chunks) {
    List<ChunkingResult.RejectedSpan> spans =
        rejected == 0 ? List.of() : List.of(new ChunkingResult.RejectedSpan(0, 10, 0.1));
    when(documentChunker.chunk(eq(documentId), eq("device-1"), any(ExtractedText.class)))
        .thenReturn(new ChunkingResult(List.of(chunks), spans));
  }

  @Test
  @DisplayName("Should chunk, embed, store and register a document")
  @SuppressWarnings("unchecked")
  void shouldIngestDocument() {
    String documentId = registry.documentIdFor("device-1", "ifu.txt");
    chunksFor(documentId, 1, chunk(documentId, 0, "Generic name: Pulse Oximeter"));
    when(embeddingService.embedTexts(anyList())).thenReturn(List.of(List.of(0.1f, 0.2f)));

    Document document = service.ingest(source("ifu.txt", TEXT));

    assertThat(document.id()).isEqualTo(documentId);
    assertThat(document.chunkIds()).containsExactly(documentId + "_0");
    assertThat(document.rejectedChunkCount()).isEqualTo(1);
    assertThat(document.ingestedAt()).isEqualTo(NOW);
    assertThat(registry.find("device-1", documentId)).contains(document);

    ArgumentCaptor<List<VectorRecord>> records = ArgumentCaptor.forClass(List.class);
    verify(vectorStore).upsert(records.capture(), eq("device-1"));
    assertThat(records.getValue()).hasSize(1);
    assertThat(records.getValue().get(0).metadata().filename()).isEqualTo("ifu.txt");
    verify(vectorStore, never()).deleteDocument(anyString(), anyString());
    assertThat(meterRegistry.counter("document.chunks.ingested").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should replace the previous chunks when a file is ingested again")
  void shouldReplaceOnReingestion() {
    String documentId = registry.documentIdFor("device-1", "ifu.txt");
    chunksFor(documentId, 0, chunk(documentId, 0, "Generic name: Pulse Oximeter"));
    when(embeddingService.embedTexts(anyList())).thenReturn(List.of(List.of(0.1f, 0.2f)));

    service.ingest(source("ifu.txt", TEXT));
    service.ingest(source("ifu.txt", TEXT));

    verify(vectorStore).deleteDocument(documentId, "device-1");
    assertThat(registry.list("device-1")).hasSize(1);
  }

  @Test
  @DisplayName("Should reject a document without text")
  void shouldRejectBlankDocument() {
    assertThatThrownBy(() -> service.ingest(source("blank.txt", "  \n ")))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("No content extracted");
  }

  @Test
  @DisplayName("Should fail when embeddings are unavailable and store nothing")
  void shouldFailWhenEmbeddingUnavailable() {
    String documentId = registry.documentIdFor("device-1", "ifu.txt");
    chunksFor(documentId, 0, chunk(documentId, 0, "Generic name: Pulse Oximeter"));
    when(embeddingService.embedTexts(anyList())).thenReturn(List.of());

    assertThatThrownBy(() -> service.ingest(source("ifu.txt", TEXT)))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("expected 1 embeddings, got 0");

    verify(vectorStore, never()).upsert(anyList(), anyString());
    assertThat(registry.list("device-1")).isEmpty();
    assertThat(meterRegistry.counter("document.ingest.failed", "reason", "embedding").count())
        .isEqualTo(1.0);
  }
}
