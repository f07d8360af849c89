package com.flamingo.ai.devicerag.service.rag.synthesis;

import com.flamingo.ai.devicerag.service.rag.search.ConfidenceTier;
import java.util.Map;

/**
 * How well an answer is supported by its evidence.
 *
 * @param evidenceCount pieces of evidence given to generation
 * @param averageConfidence mean composite score of the evidence, 0 without evidence
 * @param tierCounts evidence count per confidence tier
 * @param label overall support label
 * @param generationMode how the answer text was produced
 * @param degraded true when generation was unavailable and a fallback answered
 */
public record QualityMetrics(
    int evidenceCount,
    double averageConfidence,
    Map<ConfidenceTier, Integer> tierCounts,
    Label label,
    GenerationMode generationMode,
    boolean degraded) {

  public QualityMetrics {
    tierCounts = Map.copyOf(tierCounts);
  }

  public enum Label {
    EXCELLENT,
    GOOD,
    POOR
  }

  public enum GenerationMode {
    GENERATED,
    /** Generation failed; the answer quotes the evidence directly. */
    EXTRACTIVE_FALLBACK,
    /** No evidence, so no generation was attempted. */
    NONE
  }
}
