package com.flamingo.ai.devicerag.service.rag.search;

import com.flamingo.ai.devicerag.vectorstore.ChunkMetadata;

/**
 * One ranked piece of evidence. Created per query and never persisted.
 *
 * @param chunkId id of the retrieved chunk
 * @param metadata stored chunk attributes
 * @param similarityScore best cosine similarity over all query variations
 * @param compositeScore weighted blend of similarity, quality and importance
 * @param tier confidence band of the composite score
 */
public record RetrievalResult(
    String chunkId,
    ChunkMetadata metadata,
    double similarityScore,
    double compositeScore,
    ConfidenceTier tier) {

  public String content() {
    return metadata.content();
  }

  public String filename() {
    return metadata.filename();
  }

  public String documentId() {
    return metadata.documentId();
  }
}
