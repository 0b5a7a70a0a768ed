package com.gentoro.deepresearch.exception;

/** Stable error codes attached to {@link DeepResearchException} instances. */
public enum DeepResearchErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  /** A protected dependency is failing fast while its breaker cools down. */
  CIRCUIT_OPEN,
  /** All retry attempts against a dependency failed. */
  RETRY_EXHAUSTED,
  RATE_LIMITED,
  NETWORK_ERROR
}
