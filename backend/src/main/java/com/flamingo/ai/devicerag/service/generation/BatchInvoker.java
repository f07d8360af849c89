package com.flamingo.ai.devicerag.service.generation;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.google.common.collect.Lists;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Single entry point for calls to the generative completion service.
 *
 * <p>Items are grouped into batches of at most {@code maxBatchSize}, one external call per batch.
 * Batches run concurrently but every call passes through the shared {@link RateGovernor}. Results
 * always come back in input order, one per item.
 */
@Service
@Slf4j
public class BatchInvoker {

  static final String CIRCUIT_BREAKER_NAME = "generation";

  private final RagConfig ragConfig;
  private final CompletionClient completionClient;
  private final RateGovernor rateGovernor;
  private final ResponseCache responseCache;
  private final BatchResponseParser parser;
  private final CircuitBreaker circuitBreaker;
  private final MeterRegistry meterRegistry;
  private final Executor executor;
  private final RetryPolicy retryPolicy;

  public BatchInvoker(
      RagConfig ragConfig,
      CompletionClient completionClient,
      RateGovernor rateGovernor,
      ResponseCache responseCache,
      BatchResponseParser parser,
      CircuitBreakerRegistry circuitBreakerRegistry,
      MeterRegistry meterRegistry,
      @Qualifier("generationExecutor") Executor executor,
      GovernorClock clock) {
    this.ragConfig = ragConfig;
    this.completionClient = completionClient;
    this.rateGovernor = rateGovernor;
    this.responseCache = responseCache;
    this.parser = parser;
    this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
    this.meterRegistry = meterRegistry;
    this.executor = executor;
    RagConfig.Generation generation = ragConfig.getGeneration();
    this.retryPolicy =
        new RetryPolicy(
            generation.getMaxAttempts(),
            generation.getInitialBackoff(),
            generation.getMaxBackoff(),
            clock);
  }

  /**
   * Answers every item, batching them into as few calls as the configured batch size allows.
   *
   * @param items logical sub-requests
   * @param options prompt instructions, sampling settings and optional per-item fallback
   * @return one result per item, in input order
   */
  public List<ItemResult> invoke(List<BatchItem> items, InvocationOptions options) {
    if (items.isEmpty()) {
      return List.of();
    }
    int batchSize =
        options.singleBatch()
            ? items.size()
            : Math.max(1, ragConfig.getGeneration().getMaxBatchSize());
    List<List<BatchItem>> batches = Lists.partition(items, batchSize);
    log.debug(
        "Invoking '{}' for {} items in {} batches",
        options.purpose(),
        items.size(),
        batches.size());

    List<CompletableFuture<List<ItemResult>>> futures = new ArrayList<>();
    for (List<BatchItem> batch : batches) {
      futures.add(CompletableFuture.supplyAsync(() -> processBatch(batch, options), executor));
    }

    List<ItemResult> results = new ArrayList<>(items.size());
    int offset = 0;
    for (int b = 0; b < batches.size(); b++) {
      List<ItemResult> batchResults = futures.get(b).join();
      for (ItemResult result : batchResults) {
        results.add(new ItemResult(offset + result.index(), result.value(), result.status()));
      }
      offset += batches.get(b).size();
    }
    return List.copyOf(results);
  }

  /** Convenience for a single prompt; returns the answer or the failure status. */
  public ItemResult invokeSingle(String id, String content, InvocationOptions options) {
    return invoke(List.of(new BatchItem(id, content)), options).get(0);
  }

  /** Processes one batch; result indexes are relative to the batch. */
  private List<ItemResult> processBatch(List<BatchItem> batch, InvocationOptions options) {
    String key = responseCache.keyFor(batch, options);
    String cached = responseCache.get(key, batch.size());
    if (cached != null) {
      Optional<List<String>> parsed = parser.parse(cached, batch.size());
      if (parsed.isPresent()) {
        log.debug("Cache hit for '{}' batch of {}", options.purpose(), batch.size());
        return toResults(parsed.get(), ItemStatus.CACHED);
      }
    }

    String prompt = parser.buildPrompt(options.instructions(), batch);
    CompletionRequest request =
        new CompletionRequest(prompt, options.temperature(), options.maxTokens());

    Timer.Sample sample = Timer.start(meterRegistry);
    CallOutcome outcome = retryPolicy.execute(() -> governedCall(request));
    sample.stop(
        meterRegistry.timer(
            "generation.batch.duration",
            "purpose",
            options.purpose(),
            "status",
            outcome.status().name().toLowerCase(Locale.ROOT)));

    switch (outcome.status()) {
      case OK:
        Optional<List<String>> parsed = parser.parse(outcome.value(), batch.size());
        if (parsed.isPresent()) {
          responseCache.put(key, outcome.value());
          return toResults(parsed.get(), ItemStatus.GENERATED);
        }
        return handleParseMismatch(batch, options);
      case EXHAUSTED:
        meterRegistry.counter("generation.batch.throttled", "purpose", options.purpose())
            .increment();
        log.warn("Batch of {} for '{}' exhausted retries", batch.size(), options.purpose());
        return failedResults(batch.size(), ItemStatus.THROTTLED);
      default:
        meterRegistry.counter("generation.batch.unavailable", "purpose", options.purpose())
            .increment();
        log.warn(
            "Batch of {} for '{}' unavailable: {}",
            batch.size(),
            options.purpose(),
            outcome.reason());
        return failedResults(batch.size(), ItemStatus.UNAVAILABLE);
    }
  }

  private String governedCall(CompletionRequest request) {
    return rateGovernor.execute(
        () -> circuitBreaker.executeSupplier(() -> completionClient.complete(request)));
  }

  private List<ItemResult> handleParseMismatch(List<BatchItem> batch, InvocationOptions options) {
    meterRegistry.counter("generation.batch.parse_mismatch", "purpose", options.purpose())
        .increment();
    if (batch.size() > 1) {
      int middle = batch.size() / 2;
      log.info(
          "Response for '{}' did not map onto {} items, retrying as {} + {}",
          options.purpose(),
          batch.size(),
          middle,
          batch.size() - middle);
      List<ItemResult> results = new ArrayList<>(processBatch(batch.subList(0, middle), options));
      for (ItemResult right : processBatch(batch.subList(middle, batch.size()), options)) {
        results.add(new ItemResult(middle + right.index(), right.value(), right.status()));
      }
      return results;
    }

    BatchItem item = batch.get(0);
    if (options.fallback() == null) {
      log.warn("Unparseable response for item {} of '{}'", item.id(), options.purpose());
      return failedResults(1, ItemStatus.PARSE_FAILED);
    }
    log.info("Falling back to heuristic for item {} of '{}'", item.id(), options.purpose());
    return List.of(new ItemResult(0, options.fallback().apply(item), ItemStatus.FALLBACK));
  }

  private List<ItemResult> toResults(List<String> values, ItemStatus status) {
    List<ItemResult> results = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      results.add(new ItemResult(i, values.get(i), status));
    }
    return results;
  }

  private List<ItemResult> failedResults(int size, ItemStatus status) {
    List<ItemResult> results = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      results.add(new ItemResult(i, null, status));
    }
    return results;
  }
}
