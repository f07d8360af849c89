package com.flamingo.ai.devicerag.service.template.model;

/** Textual pattern that marks a fillable spot, in detection priority order. */
public enum PatternKind {
  /** Explicit markers such as [MISSING], [TO BE FILLED] or &lt;TBD&gt;. */
  MISSING_MARKER,
  BRACKET_PLACEHOLDER,
  /** "Label:" with nothing after the colon. */
  COLON_LABEL,
  UNDERLINE_SHORT,
  SIGNATURE_LINE,
  DOT_LEADER,
  DATE_TOKEN
}
