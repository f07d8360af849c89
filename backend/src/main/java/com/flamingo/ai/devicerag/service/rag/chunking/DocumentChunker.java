package com.flamingo.ai.devicerag.service.rag.chunking;

import com.flamingo.ai.devicerag.service.rag.model.ChunkingResult;
import com.flamingo.ai.devicerag.service.rag.model.ExtractedText;

/** Cuts extracted document text into scored retrieval chunks. */
public interface DocumentChunker {

  /**
   * Chunks one document. Implementations must be deterministic and keep no state between calls,
   * so documents can be chunked concurrently.
   *
   * @param documentId owning document id, used to derive chunk ids
   * @param deviceId device namespace the chunks belong to
   * @param extracted text plus structural hints
   * @return accepted chunks in source order, and the spans that were rejected
   */
  ChunkingResult chunk(String documentId, String deviceId, ExtractedText extracted);
}
