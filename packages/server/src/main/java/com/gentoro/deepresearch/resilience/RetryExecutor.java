package com.gentoro.deepresearch.resilience;

import com.gentoro.deepresearch.exception.CircuitBreakerOpenException;
import com.gentoro.deepresearch.utility.CheckedSupplier;
import java.time.Duration;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;

/**
 * Bounded exponential backoff. Wrap operations that are themselves guarded by {@link
 * CircuitBreaker#call} so that breaker bookkeeping happens before the next delay is scheduled.
 */
public final class RetryExecutor {
  private static final org.slf4j.Logger log =
      com.gentoro.deepresearch.logging.LoggingService.getLogger(RetryExecutor.class);

  private final Sleeper sleeper;

  public RetryExecutor() {
    this(Sleeper.THREAD);
  }

  public RetryExecutor(Sleeper sleeper) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public <T> T retry(
      CheckedSupplier<T> operation,
      int maxRetries,
      Duration initialDelay,
      Duration maxDelay,
      double backoffBase)
      throws Exception {
    return retry(operation, new RetryPolicy(maxRetries, initialDelay, maxDelay, backoffBase));
  }

  /**
   * Invoke {@code operation} up to {@code policy.maxAttempts()} times. {@link
   * CircuitBreakerOpenException} and interruption are never retried. When every attempt fails, the
   * last failure is rethrown unchanged.
   */
  public <T> T retry(CheckedSupplier<T> operation, RetryPolicy policy) throws Exception {
    Exception lastFailure = null;
    int attempts = policy.maxAttempts();

    for (int attempt = 0; attempt < attempts; attempt++) {
      try {
        return operation.get();
      } catch (CircuitBreakerOpenException e) {
        throw e;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw e;
      } catch (Exception e) {
        lastFailure = e;
        if (attempt < policy.maxRetries()) {
          Duration delay = policy.delayForAttempt(attempt);
          log.warn(
              "[RETRY] Attempt {}/{} failed: {}. Retrying in {} ms",
              attempt + 1,
              attempts,
              StringUtils.abbreviate(String.valueOf(e.getMessage()), 100),
              delay.toMillis());
          sleeper.sleep(delay);
        } else {
          log.error("[RETRY] All {} attempts failed", attempts);
        }
      }
    }
    throw lastFailure;
  }
}
