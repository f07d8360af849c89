package com.flamingo.ai.devicerag.exception;

import java.time.Duration;

/** Exception thrown when the completion service fails or throttles a call. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;
  private final Duration retryAfter;
  private final String userMessage;

  public LlmServiceException(String message) {
    super(message);
    this.rateLimited = false;
    this.retryAfter = null;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = false;
    this.retryAfter = null;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public LlmServiceException(String message, boolean rateLimited) {
    this(message, rateLimited, null, null);
  }

  public LlmServiceException(
      String message, boolean rateLimited, Duration retryAfter, Throwable cause) {
    super(message, cause);
    this.rateLimited = rateLimited;
    this.retryAfter = retryAfter;
    this.userMessage =
        rateLimited
            ? "Service is temporarily busy. Please try again in a moment."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  /** Server-suggested delay before retrying, or null when none was given. */
  public Duration getRetryAfter() {
    return retryAfter;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
