package com.flamingo.ai.devicerag.service.generation;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Process-local, append-only cache of successful batch responses.
 *
 * <p>Keys are SHA-256 hashes of the canonicalized batch plus the invocation options. Entries are
 * never replaced; when two writers race on one key the first write is kept.
 */
@Component
@Slf4j
public class ResponseCache {

  private final Map<String, String> entries = new ConcurrentHashMap<>();
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final Counter hitCounter;
  private final Counter missCounter;

  public ResponseCache(MeterRegistry meterRegistry) {
    this.hitCounter = meterRegistry.counter("generation.cache.hits");
    this.missCounter = meterRegistry.counter("generation.cache.misses");
    meterRegistry.gaugeMapSize("generation.cache.size", Tags.empty(), entries);
  }

  /** Computes the cache key for a batch under the given options. */
  public String keyFor(List<BatchItem> batch, InvocationOptions options) {
    Hasher hasher = Hashing.sha256().newHasher();
    hasher.putString(options.cacheDiscriminator(), StandardCharsets.UTF_8);
    for (BatchItem item : batch) {
      hasher.putChar('\u001e');
      hasher.putString(canonicalize(item.content()), StandardCharsets.UTF_8);
    }
    return hasher.hash().toString();
  }

  /**
   * Looks up a response; every item of a batch served from the cache counts as one hit.
   *
   * @return the cached raw response or null
   */
  public String get(String key, int itemCount) {
    String value = entries.get(key);
    if (value != null) {
      hits.addAndGet(itemCount);
      hitCounter.increment(itemCount);
    } else {
      misses.addAndGet(itemCount);
      missCounter.increment(itemCount);
    }
    return value;
  }

  public void put(String key, String response) {
    if (entries.putIfAbsent(key, response) == null) {
      log.debug("Cached response {}", key.substring(0, 12));
    }
  }

  public long hits() {
    return hits.get();
  }

  public long misses() {
    return misses.get();
  }

  public int size() {
    return entries.size();
  }

  static String canonicalize(String content) {
    if (content == null) {
      return "";
    }
    String normalized = Normalizer.normalize(content, Normalizer.Form.NFC);
    return normalized.strip().replaceAll("\\s+", " ");
  }
}
