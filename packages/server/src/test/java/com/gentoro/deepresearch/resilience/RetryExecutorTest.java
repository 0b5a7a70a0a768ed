package com.gentoro.deepresearch.resilience;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.deepresearch.exception.CircuitBreakerOpenException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {

  private final List<Duration> delays = new ArrayList<>();
  private final RetryExecutor executor = new RetryExecutor(delay -> delays.add(delay));
  private final RetryPolicy policy =
      new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0);

  @Test
  void succeedsAfterTransientFailures() throws Exception {
    AtomicInteger calls = new AtomicInteger();

    String result =
        executor.retry(
            () -> {
              if (calls.incrementAndGet() <= 2) {
                throw new IOException("flaky");
              }
              return "done";
            },
            policy);

    assertEquals("done", result);
    assertEquals(3, calls.get());
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), delays);
  }

  @Test
  void rethrowsLastFailureWhenAttemptsAreExhausted() {
    AtomicInteger calls = new AtomicInteger();

    IOException ex =
        assertThrows(
            IOException.class,
            () ->
                executor.retry(
                    () -> {
                      throw new IOException("failure " + calls.incrementAndGet());
                    },
                    policy));

    assertEquals("failure 4", ex.getMessage());
    assertEquals(4, calls.get());
    assertEquals(
        List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), delays);
  }

  @Test
  void delaysAreCappedAtMaxDelay() {
    RetryPolicy capped = new RetryPolicy(4, Duration.ofSeconds(1), Duration.ofSeconds(3), 2.0);

    assertThrows(
        IllegalStateException.class,
        () ->
            executor.retry(
                () -> {
                  throw new IllegalStateException("nope");
                },
                capped));

    assertEquals(
        List.of(
            Duration.ofSeconds(1),
            Duration.ofSeconds(2),
            Duration.ofSeconds(3),
            Duration.ofSeconds(3)),
        delays);
  }

  @Test
  void openBreakerIsNeverRetried() {
    AtomicInteger calls = new AtomicInteger();

    assertThrows(
        CircuitBreakerOpenException.class,
        () ->
            executor.retry(
                () -> {
                  calls.incrementAndGet();
                  throw new CircuitBreakerOpenException("writer", 42);
                },
                policy));

    assertEquals(1, calls.get());
    assertTrue(delays.isEmpty());
  }

  @Test
  void zeroRetriesMeansSingleAttempt() {
    AtomicInteger calls = new AtomicInteger();

    assertThrows(
        IOException.class,
        () ->
            executor.retry(
                () -> {
                  calls.incrementAndGet();
                  throw new IOException("once");
                },
                0,
                Duration.ofMillis(10),
                Duration.ofMillis(10),
                2.0));

    assertEquals(1, calls.get());
    assertTrue(delays.isEmpty());
  }

  @Test
  void policyComputesExponentialDelays() {
    RetryPolicy p = new RetryPolicy(5, Duration.ofMillis(500), Duration.ofSeconds(5), 3.0);
    assertEquals(Duration.ofMillis(500), p.delayForAttempt(0));
    assertEquals(Duration.ofMillis(1500), p.delayForAttempt(1));
    assertEquals(Duration.ofMillis(4500), p.delayForAttempt(2));
    assertEquals(Duration.ofSeconds(5), p.delayForAttempt(3));
    assertEquals(6, p.maxAttempts());
  }

  @Test
  void policyDefaultsApplyWhenKeysAreMissing() {
    RetryPolicy fromEmpty = RetryPolicy.fromConfiguration(new BaseConfiguration());

    assertEquals(RetryPolicy.DEFAULTS, fromEmpty);
    assertEquals(3, fromEmpty.maxRetries());
    assertEquals(Duration.ofSeconds(2), fromEmpty.initialDelay());
    assertEquals(Duration.ofSeconds(10), fromEmpty.maxDelay());
    assertEquals(2.0, fromEmpty.backoffBase());
  }

  @Test
  void policyRejectsInvalidValues() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, 2.0));
    assertThrows(
        IllegalArgumentException.class,
        () -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.5));
  }
}
