package com.flamingo.ai.devicerag.service.rag.search;

/** Confidence bands for retrieved evidence, strongest first. */
public enum ConfidenceTier {
  CRITICAL,
  HIGH,
  ACCEPTABLE,
  /** Below the acceptable threshold; never returned by retrieval. */
  REJECTED;

  public boolean isPreferred() {
    return this == CRITICAL || this == HIGH;
  }
}
