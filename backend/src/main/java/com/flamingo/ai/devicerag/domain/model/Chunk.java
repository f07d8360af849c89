package com.flamingo.ai.devicerag.domain.model;

import java.util.List;

/**
 * Immutable retrieval unit cut from one ingested document. Offsets index into the extracted source
 * text, so {@code text} is exactly {@code source.substring(startOffset, endOffset)}.
 */
public record Chunk(
    String id,
    String documentId,
    String deviceId,
    int chunkIndex,
    int startOffset,
    int endOffset,
    String text,
    double qualityScore,
    double importanceScore,
    List<String> semanticKeywords,
    double entityDensity,
    ContentType contentType) {

  public Chunk {
    semanticKeywords = List.copyOf(semanticKeywords);
  }

  public static String idFor(String documentId, int chunkIndex) {
    return documentId + "_" + chunkIndex;
  }

  public int length() {
    return endOffset - startOffset;
  }
}
