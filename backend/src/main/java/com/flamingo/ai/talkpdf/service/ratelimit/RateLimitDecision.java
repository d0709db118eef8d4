package com.flamingo.ai.talkpdf.service.ratelimit;

/**
 * Outcome of a rate-limit check.
 *
 * @param allowed whether the call was admitted (and recorded)
 * @param remaining calls left in the current window after this one
 * @param resetInMs milliseconds until the oldest recorded call leaves the window; positive on
 *     rejection
 */
public record RateLimitDecision(boolean allowed, int remaining, long resetInMs) {}
