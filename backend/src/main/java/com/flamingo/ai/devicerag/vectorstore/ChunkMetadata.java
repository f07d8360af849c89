package com.flamingo.ai.devicerag.vectorstore;

import com.flamingo.ai.devicerag.domain.model.Chunk;
import com.flamingo.ai.devicerag.domain.model.ContentType;
import java.util.List;

/** Chunk attributes stored next to the embedding and returned with every match. */
public record ChunkMetadata(
    String documentId,
    String deviceId,
    String filename,
    int chunkIndex,
    int startOffset,
    int endOffset,
    String content,
    double qualityScore,
    double importanceScore,
    List<String> keywords,
    ContentType contentType) {

  public ChunkMetadata {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
    contentType = contentType == null ? ContentType.TEXT : contentType;
  }

  public static ChunkMetadata of(Chunk chunk, String filename) {
    return new ChunkMetadata(
        chunk.documentId(),
        chunk.deviceId(),
        filename,
        chunk.chunkIndex(),
        chunk.startOffset(),
        chunk.endOffset(),
        chunk.text().strip(),
        chunk.qualityScore(),
        chunk.importanceScore(),
        chunk.semanticKeywords(),
        chunk.contentType());
  }
}
