package com.flamingo.ai.devicerag.domain.model;

/** Coarse layout of a chunk's text. */
public enum ContentType {
  TEXT,
  /** Mostly "Label: value" lines. */
  FORM,
  /** Table rows or cells. */
  STRUCTURED,
  /** Bulleted or numbered items. */
  LIST
}
