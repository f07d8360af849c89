package com.flamingo.ai.devicerag.service.rag.search;

import java.util.List;

/**
 * Ranked evidence for one query plus what was left out.
 *
 * @param results evidence in rank order, never containing REJECTED results
 * @param variations query variations that were searched
 * @param rejectedCount candidates dropped for falling below the acceptable threshold
 * @param topics keywords covered by all candidates, most widespread first
 */
public record RetrievalOutcome(
    List<RetrievalResult> results,
    List<String> variations,
    int rejectedCount,
    List<String> topics) {

  public RetrievalOutcome {
    results = List.copyOf(results);
    variations = List.copyOf(variations);
    topics = List.copyOf(topics);
  }

  public static RetrievalOutcome empty(List<String> variations) {
    return new RetrievalOutcome(List.of(), variations, 0, List.of());
  }

  public boolean isEmpty() {
    return results.isEmpty();
  }

  /** Best composite score, or 0 when there is no evidence. */
  public double bestScore() {
    return results.isEmpty() ? 0.0 : results.get(0).compositeScore();
  }
}
