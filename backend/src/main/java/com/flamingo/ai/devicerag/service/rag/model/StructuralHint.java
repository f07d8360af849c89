package com.flamingo.ai.devicerag.service.rag.model;

/**
 * Marks a span of extracted text that came from a structural element.
 *
 * @param start inclusive start offset
 * @param end exclusive end offset
 * @param kind what the span is
 */
public record StructuralHint(int start, int end, Kind kind) {

  public enum Kind {
    TABLE_CELL,
    HEADING
  }

  public boolean contains(int offset) {
    return offset > start && offset < end;
  }
}
