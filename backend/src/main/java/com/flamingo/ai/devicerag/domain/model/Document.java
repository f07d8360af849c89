package com.flamingo.ai.devicerag.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * An ingested source document and the ids of the chunks cut from it.
 *
 * @param processed true once all chunks were embedded and stored
 * @param rejectedChunkCount chunks dropped for low quality
 */
public record Document(
    String id,
    String deviceId,
    String filename,
    List<String> chunkIds,
    boolean processed,
    int rejectedChunkCount,
    Instant ingestedAt) {

  public Document {
    chunkIds = List.copyOf(chunkIds);
  }
}
