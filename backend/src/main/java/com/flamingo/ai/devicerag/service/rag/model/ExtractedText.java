package com.flamingo.ai.devicerag.service.rag.model;

import java.util.List;

/** Plain text of one document plus the structural hints produced during extraction. */
public record ExtractedText(String text, List<StructuralHint> hints) {

  public ExtractedText {
    text = text == null ? "" : text;
    hints = hints == null ? List.of() : List.copyOf(hints);
  }

  public static ExtractedText plain(String text) {
    return new ExtractedText(text, List.of());
  }
}
