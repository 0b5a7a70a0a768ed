package com.gentoro.deepresearch.resilience;

import com.gentoro.deepresearch.exception.CircuitBreakerOpenException;
import com.gentoro.deepresearch.utility.CheckedSupplier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;

/**
 * Three-state failure isolator guarding a single upstream dependency.
 *
 * <ul>
 *   <li><b>CLOSED</b>: calls pass; each failure increments the failure count, each success resets
 *       it. Reaching the threshold opens the breaker.
 *   <li><b>OPEN</b>: calls fail with {@link CircuitBreakerOpenException} until the recovery timeout
 *       has elapsed since the last failure. The first call after that becomes the trial.
 *   <li><b>HALF_OPEN</b>: exactly one trial call is in flight. Its success closes the breaker, its
 *       failure re-opens it immediately. Other callers are rejected meanwhile.
 * </ul>
 *
 * <p>State is guarded by the instance monitor; the wrapped operation always runs outside of it.
 */
public final class CircuitBreaker {
  private static final org.slf4j.Logger log =
      com.gentoro.deepresearch.logging.LoggingService.getLogger(CircuitBreaker.class);

  private final String name;
  private final int failureThreshold;
  private final Duration recoveryTimeout;
  private final Clock clock;

  private CircuitState state = CircuitState.CLOSED;
  private int failureCount;
  private Instant lastFailureAt;

  public CircuitBreaker(String name, CircuitBreakerSettings settings) {
    this(name, settings, Clock.systemUTC());
  }

  public CircuitBreaker(String name, CircuitBreakerSettings settings, Clock clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.failureThreshold = settings.failureThreshold();
    this.recoveryTimeout = settings.recoveryTimeout();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Run {@code operation} unless the breaker is open. The result is passed through unchanged and
   * any failure is rethrown as-is after being recorded.
   *
   * @throws CircuitBreakerOpenException if the call was rejected without invoking the operation
   */
  public <T> T call(CheckedSupplier<T> operation) throws Exception {
    boolean probe = admit();
    T result;
    try {
      result = operation.get();
    } catch (Throwable t) {
      recordFailure(probe, t);
      throw t;
    }
    recordSuccess(probe);
    return result;
  }

  public String name() {
    return name;
  }

  public synchronized CircuitBreakerState getState() {
    return new CircuitBreakerState(
        name,
        state,
        state == CircuitState.OPEN,
        failureCount,
        failureThreshold,
        lastFailureAt,
        recoveryTimeout.toSeconds());
  }

  /** @return true when this call is the half-open trial */
  private synchronized boolean admit() {
    switch (state) {
      case CLOSED:
        return false;
      case OPEN:
        Duration elapsed = Duration.between(lastFailureAt, clock.instant());
        if (elapsed.compareTo(recoveryTimeout) < 0) {
          throw new CircuitBreakerOpenException(name, ceilSeconds(recoveryTimeout.minus(elapsed)));
        }
        state = CircuitState.HALF_OPEN;
        log.info("[{}] Circuit breaker entering half-open state, testing service...", name);
        return true;
      case HALF_OPEN:
      default:
        throw new CircuitBreakerOpenException(name, 0);
    }
  }

  private synchronized void recordSuccess(boolean probe) {
    if (state == CircuitState.CLOSED) {
      failureCount = 0;
    } else if (probe) {
      failureCount = 0;
      state = CircuitState.CLOSED;
      log.info("[{}] Trial call succeeded, circuit breaker closed", name);
    }
    // A late success from a call admitted before the breaker opened does not close it.
  }

  private synchronized void recordFailure(boolean probe, Throwable failure) {
    failureCount++;
    lastFailureAt = clock.instant();
    log.warn(
        "[{}] Failure {}/{}: {}",
        name,
        failureCount,
        failureThreshold,
        StringUtils.abbreviate(String.valueOf(failure.getMessage()), 100));

    if (probe) {
      state = CircuitState.OPEN;
      log.warn("[{}] Trial call failed, circuit breaker re-opened", name);
    } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
      state = CircuitState.OPEN;
      log.warn("[{}] Circuit breaker opened after {} failures", name, failureCount);
    }
  }

  private static long ceilSeconds(Duration d) {
    long millis = d.toMillis();
    return (millis + 999) / 1000;
  }
}
