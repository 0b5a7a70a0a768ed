package com.gentoro.deepresearch.resilience;

/** Lifecycle state of a {@link CircuitBreaker}. */
public enum CircuitState {
  /** Calls pass through; failures are counted. */
  CLOSED,
  /** Calls fail immediately until the recovery timeout has elapsed. */
  OPEN,
  /** A single trial call is in flight; everything else is rejected. */
  HALF_OPEN
}
