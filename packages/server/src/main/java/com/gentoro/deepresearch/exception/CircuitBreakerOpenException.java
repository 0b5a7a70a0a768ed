package com.gentoro.deepresearch.exception;

/**
 * Raised when a call is rejected because the named circuit breaker is open. Never retried: the
 * retry layer rethrows it immediately.
 */
public class CircuitBreakerOpenException extends DeepResearchException {
  private final String breakerName;
  private final long cooldownSeconds;

  public CircuitBreakerOpenException(String breakerName, long cooldownSeconds) {
    super(
        DeepResearchErrorCode.CIRCUIT_OPEN,
        "Circuit breaker '%s' is open. Service temporarily unavailable. Try again in %ds"
            .formatted(breakerName, cooldownSeconds));
    this.breakerName = breakerName;
    this.cooldownSeconds = cooldownSeconds;
    withContext("breaker", breakerName);
    withContext("cooldownSeconds", cooldownSeconds);
  }

  public String getBreakerName() {
    return breakerName;
  }

  /** Remaining seconds before the breaker lets a trial call through. */
  public long getCooldownSeconds() {
    return cooldownSeconds;
  }
}
