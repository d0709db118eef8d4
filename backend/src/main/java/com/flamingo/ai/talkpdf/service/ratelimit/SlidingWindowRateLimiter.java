package com.flamingo.ai.talkpdf.service.ratelimit;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process sliding-window limiter keyed by (action, user).
 *
 * <p>Each key holds the timestamps of admitted calls. A call is rejected when the window {@code
 * (now - windowMs, now]} already holds {@code maxRequests} of them. State is lost on restart and is
 * not shared between instances.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlidingWindowRateLimiter {

  private final ConcurrentMap<String, Deque<Long>> windows = new ConcurrentHashMap<>();
  private final AtomicLong longestWindowMs = new AtomicLong();
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  /**
   * Checks and, when admitted, records a call.
   *
   * @param userId caller identity
   * @param actionKey the limited action, e.g. {@code process-document}
   * @param windowMs window length in milliseconds
   * @param maxRequests calls admitted per window
   * @return the decision
   */
  public RateLimitDecision allow(String userId, String actionKey, long windowMs, int maxRequests) {
    long now = clock.millis();
    longestWindowMs.accumulateAndGet(windowMs, Math::max);
    RateLimitDecision[] decision = new RateLimitDecision[1];

    // compute() serializes callers of the same key
    windows.compute(
        key(actionKey, userId),
        (key, existing) -> {
          Deque<Long> timestamps = existing != null ? existing : new ArrayDeque<>();
          evictOlderThan(timestamps, now - windowMs);

          if (timestamps.size() >= maxRequests) {
            long resetInMs = Math.max(1, timestamps.peekFirst() + windowMs - now);
            decision[0] = new RateLimitDecision(false, 0, resetInMs);
          } else {
            timestamps.addLast(now);
            decision[0] =
                new RateLimitDecision(
                    true, maxRequests - timestamps.size(), timestamps.peekFirst() + windowMs - now);
          }
          return timestamps;
        });

    if (!decision[0].allowed()) {
      meterRegistry.counter("rate_limit.rejected", "action", actionKey).increment();
      log.debug(
          "Rejected {} for user {}: resets in {} ms", actionKey, userId, decision[0].resetInMs());
    }
    return decision[0];
  }

  /**
   * Drops windows holding no timestamp newer than {@code windowMs}.
   *
   * @return number of windows removed
   */
  public int evictExpired(long windowMs) {
    long cutoff = clock.millis() - windowMs;
    int[] removed = {0};
    for (String key : windows.keySet()) {
      windows.computeIfPresent(
          key,
          (k, timestamps) -> {
            evictOlderThan(timestamps, cutoff);
            if (timestamps.isEmpty()) {
              removed[0]++;
              return null;
            }
            return timestamps;
          });
    }
    return removed[0];
  }

  @Scheduled(fixedDelayString = "${talkpdf.rate-limit.cleanup-interval-ms:300000}")
  void scheduledCleanup() {
    int removed = evictExpired(longestWindowMs.get());
    if (removed > 0) {
      log.debug("Evicted {} idle rate-limit windows", removed);
    }
  }

  @VisibleForTesting
  int trackedKeys() {
    return windows.size();
  }

  private static void evictOlderThan(Deque<Long> timestamps, long cutoff) {
    while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
      timestamps.pollFirst();
    }
  }

  private static String key(String actionKey, String userId) {
    return actionKey + ":" + userId;
  }
}
