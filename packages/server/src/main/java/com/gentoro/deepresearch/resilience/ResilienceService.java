package com.gentoro.deepresearch.resilience;

import com.gentoro.deepresearch.exception.CircuitBreakerOpenException;
import com.gentoro.deepresearch.exception.RetryExhaustedException;
import com.gentoro.deepresearch.exception.StateException;
import com.gentoro.deepresearch.utility.CheckedSupplier;
import java.util.Objects;

/**
 * Boundary used by the pipeline for every upstream call: retry with backoff around the named
 * dependency's circuit breaker.
 */
public final class ResilienceService {
  private final CircuitBreakerRegistry breakers;
  private final RetryExecutor retryExecutor;
  private final RetryPolicy defaultPolicy;

  public ResilienceService(
      CircuitBreakerRegistry breakers, RetryExecutor retryExecutor, RetryPolicy defaultPolicy) {
    this.breakers = Objects.requireNonNull(breakers, "breakers");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
    this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
  }

  public <T> T withResilience(String dependency, CheckedSupplier<T> operation) {
    return withResilience(dependency, operation, defaultPolicy);
  }

  /**
   * @throws CircuitBreakerOpenException if the dependency's breaker rejected the call
   * @throws RetryExhaustedException if every attempt failed; the cause is the last failure
   */
  public <T> T withResilience(String dependency, CheckedSupplier<T> operation, RetryPolicy policy) {
    CircuitBreaker breaker = breakers.breaker(dependency);
    try {
      return retryExecutor.retry(() -> breaker.call(operation), policy);
    } catch (CircuitBreakerOpenException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StateException("Interrupted while calling " + dependency, e);
    } catch (Exception e) {
      throw new RetryExhaustedException(dependency, policy.maxAttempts(), e);
    }
  }

  public CircuitBreakerRegistry breakers() {
    return breakers;
  }

  public RetryPolicy defaultPolicy() {
    return defaultPolicy;
  }
}
