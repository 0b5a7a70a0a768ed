package com.gentoro.deepresearch.resilience;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Monitoring snapshot of a breaker. {@code lastFailure} is null until the first failure. */
public record CircuitBreakerState(
    @JsonProperty("name") String name,
    @JsonProperty("state") CircuitState state,
    @JsonProperty("is_open") boolean isOpen,
    @JsonProperty("failure_count") int failureCount,
    @JsonProperty("failure_threshold") int failureThreshold,
    @JsonProperty("last_failure") Instant lastFailure,
    @JsonProperty("recovery_timeout_seconds") long recoveryTimeoutSeconds) {}
