package com.flamingo.ai.devicerag.service.rag.synthesis;

import com.flamingo.ai.devicerag.service.rag.search.ConfidenceTier;

/**
 * Source reference for an answer. {@code documentNumber} is the 1-based evidence number used in
 * the answer's {@code [n]} markers.
 */
public record Citation(
    int documentNumber,
    String filename,
    String chunkId,
    String documentId,
    double score,
    ConfidenceTier tier,
    String preview) {}
