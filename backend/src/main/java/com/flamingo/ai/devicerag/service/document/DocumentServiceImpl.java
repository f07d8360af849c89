package com.flamingo.ai.devicerag.service.document;

import com.flamingo.ai.devicerag.domain.model.Document;
import com.flamingo.ai.devicerag.exception.DocumentNotFoundException;
import com.flamingo.ai.devicerag.service.rag.DocumentIngestionService;
import com.flamingo.ai.devicerag.vectorstore.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** Implementation of the DocumentService. */
@Service
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private final DocumentIngestionService ingestionService;
  private final DocumentRegistry documentRegistry;
  private final VectorStore vectorStore;
  private final MeterRegistry meterRegistry;
  private final Executor documentProcessingExecutor;

  public DocumentServiceImpl(
      DocumentIngestionService ingestionService,
      DocumentRegistry documentRegistry,
      VectorStore vectorStore,
      MeterRegistry meterRegistry,
      @Qualifier("documentProcessingExecutor") Executor documentProcessingExecutor) {
    this.ingestionService = ingestionService;
    this.documentRegistry = documentRegistry;
    this.vectorStore = vectorStore;
    this.meterRegistry = meterRegistry;
    this.documentProcessingExecutor = documentProcessingExecutor;
  }

  @Override
  @Timed(value = "document.upload", description = "Time to ingest uploaded documents")
  public List<IngestionOutcome> ingestAll(List<SourceDocument> sources) {
    List<CompletableFuture<IngestionOutcome>> futures = new ArrayList<>(sources.size());
    for (SourceDocument source : sources) {
      futures.add(
          CompletableFuture.supplyAsync(() -> ingestOne(source), documentProcessingExecutor));
    }
    List<IngestionOutcome> outcomes = new ArrayList<>(sources.size());
    for (CompletableFuture<IngestionOutcome> future : futures) {
      outcomes.add(future.join());
    }
    return outcomes;
  }

  @Override
  public Document ingest(SourceDocument source) {
    return ingestionService.ingest(source);
  }

  private IngestionOutcome ingestOne(SourceDocument source) {
    try {
      return new IngestionOutcome(source.filename(), ingestionService.ingest(source), null);
    } catch (CompletionException e) {
      return failed(source, e.getCause() instanceof RuntimeException r ? r : e);
    } catch (RuntimeException e) {
      return failed(source, e);
    }
  }

  private IngestionOutcome failed(SourceDocument source, RuntimeException e) {
    log.error(
        "Failed to ingest {} for device {}: {}",
        source.filename(),
        source.deviceId(),
        e.getMessage(),
        e);
    meterRegistry.counter("document.upload.failed").increment();
    return new IngestionOutcome(source.filename(), null, e);
  }

  @Override
  public List<Document> listDocuments(String deviceId) {
    return documentRegistry.list(deviceId);
  }

  @Override
  public Document getDocument(String deviceId, String documentId) {
    return documentRegistry
        .find(deviceId, documentId)
        .orElseThrow(() -> new DocumentNotFoundException(deviceId, documentId));
  }

  @Override
  @Timed(value = "document.delete", description = "Time to delete a document")
  public void deleteDocument(String deviceId, String documentId) {
    Document document = getDocument(deviceId, documentId);
    vectorStore.deleteDocument(documentId, deviceId);
    documentRegistry.remove(deviceId, documentId);
    meterRegistry.counter("document.deleted").increment();
    log.info(
        "Deleted document {} ({}) with {} chunks from device {}",
        documentId,
        document.filename(),
        document.chunkIds().size(),
        deviceId);
  }
}
