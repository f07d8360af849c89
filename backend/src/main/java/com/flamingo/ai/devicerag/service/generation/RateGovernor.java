package com.flamingo.ai.devicerag.service.generation;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide gate for every external call (completion, embedding, vector search).
 *
 * <p>Two limits apply regardless of caller: at most {@code maxConcurrent} calls are in flight, and
 * any two call starts are separated by at least {@code minDelayBetweenCalls}. A single instance is
 * created at startup and shared by reference.
 */
@Slf4j
public class RateGovernor {

  /** Observes call starts; used for metrics and by tests that inspect start timestamps. */
  @FunctionalInterface
  public interface CallStartListener {
    void onCallStart(long startNanos, int inFlight);
  }

  private final int maxConcurrent;
  private final long minDelayNanos;
  private final GovernorClock clock;
  private final CallStartListener listener;

  private final Semaphore permits;
  private final ReentrantLock startLock = new ReentrantLock(true);
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger peakInFlight = new AtomicInteger();

  // guarded by startLock
  private long lastCallStartNanos;
  private boolean started;

  public RateGovernor(
      int maxConcurrent,
      Duration minDelayBetweenCalls,
      GovernorClock clock,
      CallStartListener listener) {
    if (maxConcurrent < 1) {
      throw new IllegalArgumentException("maxConcurrent must be at least 1");
    }
    this.maxConcurrent = maxConcurrent;
    this.minDelayNanos = Math.max(0, minDelayBetweenCalls.toNanos());
    this.clock = clock;
    this.listener = listener != null ? listener : (start, count) -> {};
    this.permits = new Semaphore(maxConcurrent, true);
  }

  /**
   * Runs the call once a concurrency permit and a start slot are available.
   *
   * @throws CancellationException if the thread is interrupted while waiting
   */
  public <T> T execute(Supplier<T> call) {
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting for a call permit");
    }
    try {
      awaitStartSlot();
      try {
        return call.get();
      } finally {
        inFlight.decrementAndGet();
      }
    } finally {
      permits.release();
    }
  }

  private void awaitStartSlot() {
    startLock.lock();
    try {
      if (started) {
        long wait = lastCallStartNanos + minDelayNanos - clock.nanoTime();
        while (wait > 0) {
          clock.sleep(Duration.ofNanos(wait));
          wait = lastCallStartNanos + minDelayNanos - clock.nanoTime();
        }
      }
      long now = clock.nanoTime();
      lastCallStartNanos = now;
      started = true;
      int current = inFlight.incrementAndGet();
      peakInFlight.accumulateAndGet(current, Math::max);
      log.trace("Call start at {} ns, in flight {}", now, current);
      listener.onCallStart(now, current);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while spacing call starts");
    } finally {
      startLock.unlock();
    }
  }

  public int maxConcurrent() {
    return maxConcurrent;
  }

  public int inFlight() {
    return inFlight.get();
  }

  public int peakInFlight() {
    return peakInFlight.get();
  }
}
