package com.flamingo.ai.devicerag.service.generation;

import com.flamingo.ai.devicerag.exception.LlmServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded retry loop for throttled calls. Throttling is retried with exponential backoff (or the
 * server's retry-after hint when one is given); every other failure ends the loop immediately.
 */
@Slf4j
public class RetryPolicy {

  private final int maxAttempts;
  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final GovernorClock clock;

  public RetryPolicy(
      int maxAttempts, Duration initialBackoff, Duration maxBackoff, GovernorClock clock) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
    this.clock = clock;
  }

  /**
   * Runs the call until it succeeds, fails for a non-throttling reason, or runs out of attempts.
   *
   * @return {@code OK}, {@code UNAVAILABLE} or {@code EXHAUSTED}; never {@code THROTTLED}
   */
  public CallOutcome execute(Supplier<String> call) {
    CallOutcome outcome = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      outcome = attempt(call);
      if (outcome.status() != CallOutcome.Status.THROTTLED) {
        return outcome;
      }
      if (attempt == maxAttempts) {
        break;
      }
      Duration delay = backoff(attempt, outcome.retryAfter());
      log.warn("Call throttled (attempt {}/{}), backing off {}", attempt, maxAttempts, delay);
      try {
        clock.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return CallOutcome.unavailable("interrupted during backoff");
      }
    }
    log.warn("Call still throttled after {} attempts", maxAttempts);
    return CallOutcome.exhausted(outcome.retryAfter());
  }

  private CallOutcome attempt(Supplier<String> call) {
    try {
      return CallOutcome.ok(call.get());
    } catch (LlmServiceException e) {
      if (e.isRateLimited()) {
        return CallOutcome.throttled(e.getRetryAfter());
      }
      log.warn("Call failed: {}", e.getMessage());
      return CallOutcome.unavailable(e.getMessage());
    } catch (CallNotPermittedException e) {
      log.warn("Generation circuit is open, call not attempted");
      return CallOutcome.unavailable("circuit open");
    } catch (CancellationException e) {
      return CallOutcome.unavailable(e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Call failed unexpectedly: {}", e.getMessage(), e);
      return CallOutcome.unavailable(e.getMessage());
    }
  }

  Duration backoff(int attempt, Duration retryAfter) {
    if (retryAfter != null && !retryAfter.isNegative()) {
      return retryAfter;
    }
    Duration delay = initialBackoff.multipliedBy(1L << Math.min(attempt - 1, 20));
    return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
  }
}
