package com.flamingo.ai.devicerag.service.rag.embedding;

import com.flamingo.ai.devicerag.service.generation.RateGovernor;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates text embeddings. Every call to the embedding model passes through the shared {@link
 * RateGovernor}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small has an 8192 token limit; stay well below it
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final RateGovernor rateGovernor;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds one text.
   *
   * @return the vector, or an empty list when the model is unavailable
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextFallback")
  @Retry(name = "openai")
  public List<Float> embedText(String text) {
    String input = truncate(text);
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = rateGovernor.execute(() -> embeddingModel.embed(input));
      meterRegistry.counter("embedding.requests.success").increment();
      return toList(response.content().vector());
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  /**
   * Embeds texts one call at a time, keeping input order.
   *
   * @return one vector per text, or an empty list when the model is unavailable
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextsFallback")
  @Retry(name = "openai")
  public List<List<Float>> embedTexts(List<String> texts) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<List<Float>> results = new ArrayList<>(texts.size());
      for (String text : texts) {
        String input = truncate(text);
        Response<Embedding> response = rateGovernor.execute(() -> embeddingModel.embed(input));
        results.add(toList(response.content().vector()));
      }
      meterRegistry.counter("embedding.requests.success").increment(texts.size());
      return results;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  private String truncate(String text) {
    if (text.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          text.length(),
          MAX_CHARS_PER_EMBEDDING);
      return text.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    return text;
  }

  private static List<Float> toList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedTextFallback(String text, Throwable t) {
    log.error("Embedding failed, circuit breaker open or call rejected: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedTextsFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} texts failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment(texts.size());
    return List.of();
  }
}
