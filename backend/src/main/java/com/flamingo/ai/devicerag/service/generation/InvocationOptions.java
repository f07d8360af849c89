package com.flamingo.ai.devicerag.service.generation;

import java.util.function.Function;

/**
 * Per-invocation settings. Everything except {@code fallback} takes part in the cache key.
 *
 * @param purpose short label used for metrics and logs (e.g. "query-expansion")
 * @param instructions task instructions placed before the items
 * @param temperature sampling temperature
 * @param maxTokens completion token limit
 * @param singleBatch send all items in one call regardless of the configured batch size
 * @param fallback per-item heuristic used when a batch response cannot be parsed; may be null
 */
public record InvocationOptions(
    String purpose,
    String instructions,
    double temperature,
    int maxTokens,
    boolean singleBatch,
    Function<BatchItem, String> fallback) {

  public static InvocationOptions of(
      String purpose, String instructions, double temperature, int maxTokens) {
    return new InvocationOptions(purpose, instructions, temperature, maxTokens, false, null);
  }

  public InvocationOptions inSingleBatch() {
    return new InvocationOptions(purpose, instructions, temperature, maxTokens, true, fallback);
  }

  public InvocationOptions withFallback(Function<BatchItem, String> heuristic) {
    return new InvocationOptions(
        purpose, instructions, temperature, maxTokens, singleBatch, heuristic);
  }

  String cacheDiscriminator() {
    return purpose + '\u0000' + instructions + '\u0000' + temperature + '\u0000' + maxTokens;
  }
}
