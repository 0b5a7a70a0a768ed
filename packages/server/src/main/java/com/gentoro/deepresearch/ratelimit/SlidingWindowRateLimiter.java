package com.gentoro.deepresearch.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Per-client sliding window admission control. Each client keeps the timestamps of its admitted
 * requests inside the trailing window; stale timestamps are pruned lazily when the client (or the
 * stats) are next accessed, and clients with no remaining history are forgotten.
 */
public final class SlidingWindowRateLimiter {
  private static final org.slf4j.Logger log =
      com.gentoro.deepresearch.logging.LoggingService.getLogger(SlidingWindowRateLimiter.class);

  public static final int DEFAULT_LIMIT = 10;
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

  private final int limit;
  private final long windowMillis;
  private final Clock clock;

  // guarded by this
  private final Map<String, Deque<Long>> requests = new HashMap<>();

  public SlidingWindowRateLimiter(int limit) {
    this(limit, DEFAULT_WINDOW, Clock.systemUTC());
  }

  public SlidingWindowRateLimiter(int limit, Duration window, Clock clock) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
    if (window == null || window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be positive: " + window);
    }
    this.limit = limit;
    this.windowMillis = window.toMillis();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Build from {@code ratelimit.requests-per-minute} and {@code ratelimit.window-seconds}. */
  public static SlidingWindowRateLimiter fromConfiguration(Configuration config, Clock clock) {
    return new SlidingWindowRateLimiter(
        config.getInt("ratelimit.requests-per-minute", DEFAULT_LIMIT),
        Duration.ofSeconds(config.getLong("ratelimit.window-seconds", DEFAULT_WINDOW.toSeconds())),
        clock);
  }

  /**
   * Admit or deny one request for {@code clientKey}. An admitted request is recorded; a denied one
   * is not, and its {@code retryAfterSeconds} tells when the oldest recorded request leaves the
   * window.
   */
  public synchronized RateLimitDecision checkRateLimit(String clientKey) {
    Objects.requireNonNull(clientKey, "clientKey");
    long now = clock.millis();
    Deque<Long> history = requests.computeIfAbsent(clientKey, k -> new ArrayDeque<>());
    prune(history, now);

    if (history.size() >= limit) {
      long retryAfter = secondsUntilExpiry(history.peekFirst(), now);
      log.info(
          "Rate limit exceeded for client {} ({} requests in window), retry after {}s",
          clientKey,
          history.size(),
          retryAfter);
      return RateLimitDecision.denied(limit, retryAfter);
    }

    history.addLast(now);
    int remaining = limit - history.size();
    return RateLimitDecision.admitted(
        limit, remaining, secondsUntilExpiry(history.peekFirst(), now));
  }

  /** Remaining admissions for {@code clientKey} in the current window, without recording one. */
  public synchronized int getRemaining(String clientKey) {
    Deque<Long> history = requests.get(clientKey);
    if (history == null) return limit;
    prune(history, clock.millis());
    if (history.isEmpty()) {
      requests.remove(clientKey);
      return limit;
    }
    return Math.max(0, limit - history.size());
  }

  /** Forget every recorded request of {@code clientKey}. */
  public synchronized void resetClient(String clientKey) {
    if (requests.remove(clientKey) != null) {
      log.info("Rate limit history reset for client {}", clientKey);
    }
  }

  public synchronized RateLimiterStats getStats() {
    long now = clock.millis();
    int activeClients = 0;
    int total = 0;
    for (Iterator<Deque<Long>> it = requests.values().iterator(); it.hasNext(); ) {
      Deque<Long> history = it.next();
      prune(history, now);
      if (history.isEmpty()) {
        it.remove();
        continue;
      }
      activeClients++;
      total += history.size();
    }
    return new RateLimiterStats(activeClients, total, limit, windowMillis / 1000);
  }

  public int limit() {
    return limit;
  }

  private void prune(Deque<Long> history, long now) {
    long windowStart = now - windowMillis;
    while (!history.isEmpty() && history.peekFirst() <= windowStart) {
      history.pollFirst();
    }
  }

  private long secondsUntilExpiry(long timestamp, long now) {
    long millis = timestamp + windowMillis - now;
    return Math.max(1, (millis + 999) / 1000);
  }
}
