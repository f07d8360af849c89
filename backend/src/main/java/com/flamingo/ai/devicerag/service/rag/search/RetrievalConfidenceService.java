package com.flamingo.ai.devicerag.service.rag.search;

import com.flamingo.ai.devicerag.config.RagConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Assigns confidence tiers to retrieval scores. Helps prevent hallucinations by keeping weak
 * evidence away from generation.
 */
@Service
@Slf4j
public class RetrievalConfidenceService {

  private final MeterRegistry meterRegistry;
  private final double criticalThreshold;
  private final double highThreshold;
  private final double acceptableThreshold;

  /**
   * @throws IllegalStateException if the configured thresholds are not strictly ordered
   */
  public RetrievalConfidenceService(RagConfig ragConfig, MeterRegistry meterRegistry) {
    RagConfig.Confidence confidence = ragConfig.getConfidence();
    confidence.validate();
    this.meterRegistry = meterRegistry;
    this.criticalThreshold = confidence.getCriticalThreshold();
    this.highThreshold = confidence.getHighThreshold();
    this.acceptableThreshold = confidence.getAcceptableThreshold();
    log.info(
        "Confidence thresholds: critical={}, high={}, acceptable={}",
        criticalThreshold,
        highThreshold,
        acceptableThreshold);
  }

  public ConfidenceTier tierFor(double score) {
    if (score >= criticalThreshold) {
      return ConfidenceTier.CRITICAL;
    } else if (score >= highThreshold) {
      return ConfidenceTier.HIGH;
    } else if (score >= acceptableThreshold) {
      return ConfidenceTier.ACCEPTABLE;
    }
    return ConfidenceTier.REJECTED;
  }

  /** True when the score reaches at least the acceptable tier. */
  public boolean isAcceptable(double score) {
    return score >= acceptableThreshold;
  }

  /** Counts results per tier, with every tier present. */
  public Map<ConfidenceTier, Integer> countByTier(List<RetrievalResult> results) {
    Map<ConfidenceTier, Integer> counts = new EnumMap<>(ConfidenceTier.class);
    for (ConfidenceTier tier : ConfidenceTier.values()) {
      counts.put(tier, 0);
    }
    for (RetrievalResult result : results) {
      counts.merge(result.tier(), 1, Integer::sum);
    }
    return counts;
  }

  void recordTier(ConfidenceTier tier) {
    meterRegistry.counter("rag.confidence." + tier.name().toLowerCase(Locale.ROOT)).increment();
  }
}
