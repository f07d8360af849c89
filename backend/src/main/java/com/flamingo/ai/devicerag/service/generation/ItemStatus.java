package com.flamingo.ai.devicerag.service.generation;

/** How an item result was obtained. */
public enum ItemStatus {
  GENERATED,
  CACHED,
  /** The batch could not be parsed and the item was answered by the caller's heuristic. */
  FALLBACK,
  /** Throttling persisted beyond the retry budget. */
  THROTTLED,
  /** The service failed, timed out or the circuit is open. */
  UNAVAILABLE,
  /** The batch could not be parsed and no heuristic was supplied. */
  PARSE_FAILED
}
