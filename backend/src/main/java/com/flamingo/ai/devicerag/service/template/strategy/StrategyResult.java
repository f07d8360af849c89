package com.flamingo.ai.devicerag.service.template.strategy;

import com.flamingo.ai.devicerag.service.template.model.FillSource;

/** Outcome of one extraction strategy. FOUND and ABSENT end the chain; SKIPPED passes it on. */
public record StrategyResult(Status status, String value, FillSource source) {

  public enum Status {
    FOUND,
    /** The strategy is sure the value is not in the evidence. */
    ABSENT,
    SKIPPED
  }

  public static StrategyResult found(String value, FillSource source) {
    return new StrategyResult(Status.FOUND, value, source);
  }

  public static StrategyResult absent() {
    return new StrategyResult(Status.ABSENT, null, null);
  }

  public static StrategyResult skipped() {
    return new StrategyResult(Status.SKIPPED, null, null);
  }

  public boolean isDefinitive() {
    return status != Status.SKIPPED;
  }
}
