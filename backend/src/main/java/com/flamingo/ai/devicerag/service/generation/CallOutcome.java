package com.flamingo.ai.devicerag.service.generation;

import java.time.Duration;

/**
 * Result of one external call attempt, or of a bounded retry loop.
 *
 * @param status what happened
 * @param value generated text for {@link Status#OK}, otherwise null
 * @param retryAfter server-suggested delay for throttled outcomes, may be null
 * @param reason short description for non-OK outcomes
 */
public record CallOutcome(Status status, String value, Duration retryAfter, String reason) {

  public enum Status {
    OK,
    THROTTLED,
    UNAVAILABLE,
    EXHAUSTED
  }

  public static CallOutcome ok(String value) {
    return new CallOutcome(Status.OK, value, null, null);
  }

  public static CallOutcome throttled(Duration retryAfter) {
    return new CallOutcome(Status.THROTTLED, null, retryAfter, "throttled");
  }

  public static CallOutcome unavailable(String reason) {
    return new CallOutcome(Status.UNAVAILABLE, null, null, reason);
  }

  public static CallOutcome exhausted(Duration lastRetryAfter) {
    return new CallOutcome(Status.EXHAUSTED, null, lastRetryAfter, "retry attempts exhausted");
  }

  public boolean isOk() {
    return status == Status.OK;
  }
}
