package com.flamingo.ai.devicerag.service.generation;

/**
 * One logical sub-request inside a batched call.
 *
 * @param id caller-side identifier, used in logs only
 * @param content the item text placed in the prompt
 */
public record BatchItem(String id, String content) {}
