package com.gentoro.deepresearch.ratelimit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of an admission check. Denials carry {@code retryAfterSeconds}; admissions carry {@code
 * resetSeconds}. The unused field is null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RateLimitDecision(
    @JsonProperty("allowed") boolean allowed,
    @JsonProperty("limit") int limit,
    @JsonProperty("remaining") int remaining,
    @JsonProperty("retry_after") Long retryAfterSeconds,
    @JsonProperty("reset") Long resetSeconds) {

  static RateLimitDecision admitted(int limit, int remaining, long resetSeconds) {
    return new RateLimitDecision(true, limit, remaining, null, resetSeconds);
  }

  static RateLimitDecision denied(int limit, long retryAfterSeconds) {
    return new RateLimitDecision(false, limit, 0, retryAfterSeconds, null);
  }
}
