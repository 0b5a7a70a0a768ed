package com.gentoro.deepresearch.resilience;

import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/** Shared thresholds for the breakers created by a {@link CircuitBreakerRegistry}. */
public record CircuitBreakerSettings(int failureThreshold, Duration recoveryTimeout) {

  public static final CircuitBreakerSettings DEFAULTS =
      new CircuitBreakerSettings(5, Duration.ofSeconds(60));

  public CircuitBreakerSettings {
    if (failureThreshold <= 0) {
      throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
    }
    if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
      throw new IllegalArgumentException("recoveryTimeout must not be negative");
    }
  }

  /** Read {@code breaker.failure-threshold} and {@code breaker.recovery-timeout-seconds}. */
  public static CircuitBreakerSettings fromConfiguration(Configuration config) {
    return new CircuitBreakerSettings(
        config.getInt("breaker.failure-threshold", DEFAULTS.failureThreshold()),
        Duration.ofSeconds(
            config.getLong(
                "breaker.recovery-timeout-seconds", DEFAULTS.recoveryTimeout().toSeconds())));
  }
}
