package com.flamingo.ai.devicerag.service.rag.synthesis;

import java.util.List;

/** Final answer text with its citations, in evidence order. */
public record SynthesizedAnswer(
    String answer, List<Citation> citations, QualityMetrics qualityMetrics) {

  public SynthesizedAnswer {
    citations = List.copyOf(citations);
  }
}
