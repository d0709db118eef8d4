package com.flamingo.ai.talkpdf.exception;

/** Thrown when a caller exceeds the request budget of an action. */
public class RateLimitExceededException extends RuntimeException {

  private final String actionKey;
  private final long resetInMs;

  public RateLimitExceededException(String actionKey, long resetInMs) {
    super("Rate limit exceeded for " + actionKey + ", resets in " + resetInMs + " ms");
    this.actionKey = actionKey;
    this.resetInMs = resetInMs;
  }

  public String getActionKey() {
    return actionKey;
  }

  public long getResetInMs() {
    return resetInMs;
  }

  /** Whole seconds until retry, rounded up so a client never retries too early. */
  public long getRetryAfterSeconds() {
    return Math.max(1, (resetInMs + 999) / 1000);
  }
}
