package com.flamingo.ai.devicerag.vectorstore;

import java.util.List;

/**
 * Contract of the external vector store. The namespace is the device id and is a strict
 * partition: a query never sees records upserted under another namespace.
 */
public interface VectorStore {

  void upsert(List<VectorRecord> records, String namespace);

  /**
   * Finds the records closest to the embedding inside one namespace.
   *
   * @return up to {@code topK} matches, best first
   */
  List<VectorMatch> query(List<Float> embedding, String namespace, int topK);

  /** Removes every record of a document from a namespace. */
  void deleteDocument(String documentId, String namespace);
}
