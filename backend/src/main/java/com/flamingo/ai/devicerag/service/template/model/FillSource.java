package com.flamingo.ai.devicerag.service.template.model;

/** Where a filled value came from. */
public enum FillSource {
  GENERATED,
  /** A "label: value" line in the evidence. */
  PATTERN,
  /** A type-specific expression such as "signed by X". */
  HEURISTIC
}
