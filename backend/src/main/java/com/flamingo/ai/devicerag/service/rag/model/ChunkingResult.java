package com.flamingo.ai.devicerag.service.rag.model;

import com.flamingo.ai.devicerag.domain.model.Chunk;
import java.util.List;

/**
 * Output of one chunking run.
 *
 * @param chunks accepted chunks in source order
 * @param rejected spans dropped because their quality fell below the floor
 */
public record ChunkingResult(List<Chunk> chunks, List<RejectedSpan> rejected) {

  public ChunkingResult {
    chunks = List.copyOf(chunks);
    rejected = List.copyOf(rejected);
  }

  /** A dropped window with the quality score that caused the drop. */
  public record RejectedSpan(int startOffset, int endOffset, double qualityScore) {}
}
