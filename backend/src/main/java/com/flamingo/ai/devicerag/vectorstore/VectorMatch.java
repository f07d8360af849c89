package com.flamingo.ai.devicerag.vectorstore;

/**
 * A search hit.
 *
 * @param chunkId id of the matching chunk
 * @param score cosine similarity clamped to [0, 1]
 * @param metadata stored chunk attributes
 */
public record VectorMatch(String chunkId, double score, ChunkMetadata metadata) {}
