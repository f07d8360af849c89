package com.flamingo.ai.devicerag.service.template.model;

/** Steps of a template fill job, in execution order. ERROR is reachable from every step. */
public enum TemplateJobState {
  RAW,
  FILTERED,
  FIELDS_DETECTED,
  FIELDS_CLASSIFIED,
  QUESTIONS_GENERATED,
  RETRIEVED,
  FILLED,
  RECONSTRUCTED,
  DONE,
  ERROR;

  /** True for the next step in order, or for ERROR from any non-terminal step. */
  public boolean canTransitionTo(TemplateJobState next) {
    if (this == DONE || this == ERROR) {
      return false;
    }
    return next == ERROR || next.ordinal() == ordinal() + 1;
  }
}
