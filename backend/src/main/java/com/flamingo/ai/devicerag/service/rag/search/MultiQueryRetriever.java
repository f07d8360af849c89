package com.flamingo.ai.devicerag.service.rag.search;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.service.generation.RateGovernor;
import com.flamingo.ai.devicerag.service.rag.DocumentMetadataExtractor;
import com.flamingo.ai.devicerag.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.devicerag.service.rag.query.QueryExpansionService;
import com.flamingo.ai.devicerag.vectorstore.VectorMatch;
import com.flamingo.ai.devicerag.vectorstore.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Retrieves evidence for a query by searching several phrasings of it.
 *
 * <p>Each variation is embedded and searched within the device namespace concurrently. Results are
 * merged by chunk id keeping the best similarity, ranked by a composite of similarity, chunk
 * quality and importance, and tiered. REJECTED results never leave this class, and a result whose
 * metadata names another device is discarded.
 */
@Service
@Slf4j
public class MultiQueryRetriever {

  private static final Comparator<RetrievalResult> RANK_ORDER =
      Comparator.comparingDouble(RetrievalResult::compositeScore)
          .reversed()
          .thenComparing(RetrievalResult::chunkId);

  private final QueryExpansionService queryExpansionService;
  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final RetrievalConfidenceService confidenceService;
  private final DocumentMetadataExtractor metadataExtractor;
  private final RateGovernor rateGovernor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Executor retrievalExecutor;

  public MultiQueryRetriever(
      QueryExpansionService queryExpansionService,
      EmbeddingService embeddingService,
      VectorStore vectorStore,
      RetrievalConfidenceService confidenceService,
      DocumentMetadataExtractor metadataExtractor,
      RateGovernor rateGovernor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("retrievalExecutor") Executor retrievalExecutor) {
    this.queryExpansionService = queryExpansionService;
    this.embeddingService = embeddingService;
    this.vectorStore = vectorStore;
    this.confidenceService = confidenceService;
    this.metadataExtractor = metadataExtractor;
    this.rateGovernor = rateGovernor;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.retrievalExecutor = retrievalExecutor;
  }

  public RetrievalOutcome retrieve(String query, String deviceNamespace, int finalCount) {
    return retrieve(query, List.of(), deviceNamespace, finalCount);
  }

  /**
   * Expands the query and searches all of its variations.
   *
   * @param query user query; truncated to the configured maximum length
   * @param history recent conversation turns used as expansion context
   * @param deviceNamespace device whose documents are searched
   * @param finalCount maximum number of results
   * @throws IllegalArgumentException if the query or namespace is blank
   */
  @Timed(value = "rag.retrieve", description = "Time for multi-query retrieval")
  public RetrievalOutcome retrieve(
      String query, List<String> history, String deviceNamespace, int finalCount) {
    requireNamespace(deviceNamespace);
    String normalized = normalizeQuery(query);
    List<String> variations = queryExpansionService.expand(normalized, history);
    log.debug("Searching {} variations for device {}", variations.size(), deviceNamespace);
    return search(variations, deviceNamespace, finalCount);
  }

  /**
   * Searches pre-computed variations.
   *
   * @param variations query phrasings, searched concurrently
   * @param deviceNamespace device whose documents are searched
   * @param finalCount maximum number of results
   * @return ranked evidence, CRITICAL and HIGH preferred over ACCEPTABLE
   */
  @Timed(value = "rag.search", description = "Time to search query variations")
  public RetrievalOutcome search(List<String> variations, String deviceNamespace, int finalCount) {
    requireNamespace(deviceNamespace);
    if (variations.isEmpty() || finalCount <= 0) {
      return RetrievalOutcome.empty(variations);
    }

    List<CompletableFuture<List<VectorMatch>>> futures = new ArrayList<>(variations.size());
    for (String variation : variations) {
      futures.add(
          CompletableFuture.supplyAsync(
                  () -> searchVariation(variation, deviceNamespace), retrievalExecutor)
              .exceptionally(
                  t -> {
                    log.warn("Search for variation '{}' failed: {}", variation, t.getMessage());
                    meterRegistry.counter("rag.search.variation.failed").increment();
                    return List.of();
                  }));
    }

    Map<String, VectorMatch> merged = new LinkedHashMap<>();
    int foreign = 0;
    for (CompletableFuture<List<VectorMatch>> future : futures) {
      for (VectorMatch match : future.join()) {
        if (!deviceNamespace.equals(match.metadata().deviceId())) {
          foreign++;
          continue;
        }
        merged.merge(match.chunkId(), match, (a, b) -> b.score() > a.score() ? b : a);
      }
    }
    if (foreign > 0) {
      log.warn("Discarded {} results from outside device {}", foreign, deviceNamespace);
      meterRegistry.counter("rag.search.namespace_violations").increment(foreign);
    }

    List<String> topics =
        metadataExtractor.mergeTopics(
            merged.values().stream().map(m -> m.metadata().keywords()).toList(),
            ragConfig.getSynthesis().getMaxTopics());

    List<RetrievalResult> ranked = new ArrayList<>(merged.size());
    int rejected = 0;
    for (VectorMatch match : merged.values()) {
      RetrievalResult result = score(match);
      confidenceService.recordTier(result.tier());
      if (result.tier() == ConfidenceTier.REJECTED) {
        rejected++;
      } else {
        ranked.add(result);
      }
    }
    ranked.sort(RANK_ORDER);

    List<RetrievalResult> selected = select(ranked, finalCount);
    meterRegistry.counter("rag.search.rejected").increment(rejected);
    log.debug(
        "Device {}: {} candidates, {} rejected, {} returned",
        deviceNamespace,
        merged.size(),
        rejected,
        selected.size());
    return new RetrievalOutcome(selected, variations, rejected, topics);
  }

  private List<VectorMatch> searchVariation(String variation, String deviceNamespace) {
    List<Float> embedding = embeddingService.embedText(variation);
    if (embedding.isEmpty()) {
      log.warn("No embedding for variation '{}', skipping it", variation);
      return List.of();
    }
    int topK = ragConfig.getRetrieval().getPerQueryTopK();
    return rateGovernor.execute(() -> vectorStore.query(embedding, deviceNamespace, topK));
  }

  RetrievalResult score(VectorMatch match) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    double composite =
        retrieval.getSimilarityWeight() * match.score()
            + retrieval.getQualityWeight() * match.metadata().qualityScore()
            + retrieval.getImportanceWeight() * match.metadata().importanceScore();
    return new RetrievalResult(
        match.chunkId(),
        match.metadata(),
        match.score(),
        composite,
        confidenceService.tierFor(composite));
  }

  /** Fills with CRITICAL and HIGH results first, then ACCEPTABLE ones, keeping rank order. */
  private static List<RetrievalResult> select(List<RetrievalResult> ranked, int finalCount) {
    List<RetrievalResult> selected = new ArrayList<>();
    for (RetrievalResult result : ranked) {
      if (selected.size() < finalCount && result.tier().isPreferred()) {
        selected.add(result);
      }
    }
    for (RetrievalResult result : ranked) {
      if (selected.size() < finalCount && result.tier() == ConfidenceTier.ACCEPTABLE) {
        selected.add(result);
      }
    }
    selected.sort(RANK_ORDER);
    return selected;
  }

  private String normalizeQuery(String query) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    String stripped = query.strip();
    int maxLength = ragConfig.getRetrieval().getMaxQueryLength();
    return stripped.length() > maxLength ? stripped.substring(0, maxLength) : stripped;
  }

  private static void requireNamespace(String deviceNamespace) {
    if (deviceNamespace == null || deviceNamespace.isBlank()) {
      throw new IllegalArgumentException("Device namespace must not be blank");
    }
  }
}
