package com.flamingo.ai.devicerag.service.rag.query;

import java.util.List;

/**
 * Produces search-query variations. The original query is always the first variation and no two
 * variations differ only by case.
 */
public interface QueryExpansionService {

  /**
   * Expands one query, using recent conversation turns as context when present.
   *
   * @param query the user query
   * @param history recent conversation turns, oldest first; may be empty
   * @return up to the configured number of variations
   */
  List<String> expand(String query, List<String> history);

  /**
   * Rule-based variations used when generation fails: a wh-word swap, domain synonyms, and the
   * "Find information about" and "Details on" rewrites.
   */
  List<String> heuristicVariations(String query);
}
