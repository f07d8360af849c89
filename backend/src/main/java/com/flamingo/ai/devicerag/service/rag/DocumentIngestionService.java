package com.flamingo.ai.devicerag.service.rag;

import com.flamingo.ai.devicerag.domain.model.Chunk;
import com.flamingo.ai.devicerag.domain.model.Document;
import com.flamingo.ai.devicerag.exception.DocumentProcessingException;
import com.flamingo.ai.devicerag.service.document.DocumentRegistry;
import com.flamingo.ai.devicerag.service.document.SourceDocument;
import com.flamingo.ai.devicerag.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.devicerag.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.devicerag.service.rag.model.ChunkingResult;
import com.flamingo.ai.devicerag.service.rag.model.ExtractedText;
import com.flamingo.ai.devicerag.service.rag.parsing.TikaTextExtractor;
import com.flamingo.ai.devicerag.vectorstore.ChunkMetadata;
import com.flamingo.ai.devicerag.vectorstore.VectorRecord;
import com.flamingo.ai.devicerag.vectorstore.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Orchestrates ingestion of one document: extract, chunk, embed, and store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionService {

  private final TikaTextExtractor textExtractor;
  private final DocumentChunker documentChunker;
  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final DocumentRegistry documentRegistry;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Ingests a document. Re-ingesting a file name already registered for the device replaces all
   * of its chunks.
   *
   * @throws DocumentProcessingException if the content cannot be extracted or embedded
   */
  @Timed(value = "document.ingest", description = "Time to ingest a document")
  public Document ingest(SourceDocument source) {
    String documentId = documentRegistry.documentIdFor(source.deviceId(), source.filename());
    ExtractedText extracted = extract(documentId, source);
    if (extracted.text().isBlank()) {
      throw new DocumentProcessingException(
          documentId,
          "No content extracted from " + source.filename(),
          "The document contains no readable text");
    }
    return ingestText(documentId, source.deviceId(), source.filename(), extracted);
  }

  /** Ingests text that was already extracted. */
  public Document ingestText(
      String documentId, String deviceId, String filename, ExtractedText extracted) {
    ChunkingResult result = documentChunker.chunk(documentId, deviceId, extracted);
    List<Chunk> chunks = result.chunks();
    log.info(
        "Document {} ({}) split into {} chunks, {} rejected",
        documentId,
        filename,
        chunks.size(),
        result.rejected().size());

    List<VectorRecord> records = embed(documentId, filename, chunks);

    if (documentRegistry.find(deviceId, documentId).isPresent()) {
      log.info("Re-ingesting document {}, replacing its previous chunks", documentId);
      vectorStore.deleteDocument(documentId, deviceId);
    }
    vectorStore.upsert(records, deviceId);

    Document document =
        new Document(
            documentId,
            deviceId,
            filename,
            chunks.stream().map(Chunk::id).toList(),
            true,
            result.rejected().size(),
            Instant.now(clock));
    documentRegistry.save(document);
    meterRegistry.counter("document.ingested").increment();
    meterRegistry.counter("document.chunks.ingested").increment(chunks.size());
    return document;
  }

  private ExtractedText extract(String documentId, SourceDocument source) {
    try {
      return textExtractor.extract(source.content(), source.filename(), source.mimeType());
    } catch (IOException e) {
      meterRegistry.counter("document.ingest.failed", "reason", "extraction").increment();
      throw new DocumentProcessingException(
          documentId, "Failed to extract " + source.filename() + ": " + e.getMessage(), e);
    }
  }

  private List<VectorRecord> embed(String documentId, String filename, List<Chunk> chunks) {
    if (chunks.isEmpty()) {
      return List.of();
    }
    List<List<Float>> embeddings =
        embeddingService.embedTexts(chunks.stream().map(Chunk::text).toList());
    if (embeddings.size() != chunks.size()) {
      meterRegistry.counter("document.ingest.failed", "reason", "embedding").increment();
      throw new DocumentProcessingException(
          documentId,
          String.format(
              "Embedding generation failed: expected %d embeddings, got %d",
              chunks.size(), embeddings.size()),
          "Embedding service is unavailable. Please try again later.");
    }
    List<VectorRecord> records = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      Chunk chunk = chunks.get(i);
      records.add(
          new VectorRecord(chunk.id(), embeddings.get(i), ChunkMetadata.of(chunk, filename)));
    }
    return records;
  }
}
