package com.flamingo.ai.devicerag.service.document;

import com.flamingo.ai.devicerag.domain.model.Document;
import java.util.List;

/** Service interface for per-device document management. */
public interface DocumentService {

  /**
   * Ingests documents for a device in parallel. A document that cannot be processed fails on its
   * own; the others are still ingested.
   *
   * @param sources uploads, all for the same device
   * @return one outcome per upload, in input order
   */
  List<IngestionOutcome> ingestAll(List<SourceDocument> sources);

  /**
   * Ingests a single document.
   *
   * @throws com.flamingo.ai.devicerag.exception.DocumentProcessingException if it cannot be
   *     processed
   */
  Document ingest(SourceDocument source);

  List<Document> listDocuments(String deviceId);

  /**
   * Gets a document by id.
   *
   * @throws com.flamingo.ai.devicerag.exception.DocumentNotFoundException if not found
   */
  Document getDocument(String deviceId, String documentId);

  /**
   * Deletes a document and its vectors.
   *
   * @throws com.flamingo.ai.devicerag.exception.DocumentNotFoundException if not found
   */
  void deleteDocument(String deviceId, String documentId);

  /**
   * Result of ingesting one upload.
   *
   * @param filename upload file name
   * @param document the registered document, or null on failure
   * @param error the failure, or null on success
   */
  record IngestionOutcome(String filename, Document document, RuntimeException error) {

    public boolean isSuccess() {
      return error == null;
    }
  }
}
