package com.flamingo.ai.devicerag.vectorstore;

import java.util.List;

/** One embedding to store under a chunk id. */
public record VectorRecord(String chunkId, List<Float> embedding, ChunkMetadata metadata) {}
