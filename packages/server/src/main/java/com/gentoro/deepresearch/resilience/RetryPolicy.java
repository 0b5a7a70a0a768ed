package com.gentoro.deepresearch.resilience;

import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Immutable exponential backoff configuration. The delay before retry {@code n} (0-based) is
 * {@code min(initialDelay * backoffBase^n, maxDelay)}.
 */
public record RetryPolicy(
    int maxRetries, Duration initialDelay, Duration maxDelay, double backoffBase) {

  public static final RetryPolicy DEFAULTS =
      new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(10), 2.0);

  public RetryPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
    }
    if (initialDelay == null || initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must not be negative");
    }
    if (maxDelay == null || maxDelay.isNegative()) {
      throw new IllegalArgumentException("maxDelay must not be negative");
    }
    if (backoffBase < 1.0) {
      throw new IllegalArgumentException("backoffBase must be >= 1: " + backoffBase);
    }
  }

  /** Total number of invocations, the first call included. */
  public int maxAttempts() {
    return maxRetries + 1;
  }

  public Duration delayForAttempt(int attemptIndex) {
    double millis = initialDelay.toMillis() * Math.pow(backoffBase, attemptIndex);
    long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
    return Duration.ofMillis(capped);
  }

  /** Read the {@code retry.*} keys, falling back to {@link #DEFAULTS}. */
  public static RetryPolicy fromConfiguration(Configuration config) {
    return new RetryPolicy(
        config.getInt("retry.max-retries", DEFAULTS.maxRetries()),
        Duration.ofMillis(
            config.getLong("retry.initial-delay-millis", DEFAULTS.initialDelay().toMillis())),
        Duration.ofMillis(config.getLong("retry.max-delay-millis", DEFAULTS.maxDelay().toMillis())),
        config.getDouble("retry.backoff-base", DEFAULTS.backoffBase()));
  }
}
