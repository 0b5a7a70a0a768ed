package com.gentoro.deepresearch.exception;

import com.gentoro.deepresearch.ratelimit.RateLimitDecision;

/** A client was denied admission; carries the limiter decision so it can be surfaced verbatim. */
public class RateLimitExceededException extends DeepResearchException {
  private final RateLimitDecision decision;

  public RateLimitExceededException(String clientKey, RateLimitDecision decision) {
    super(
        DeepResearchErrorCode.RATE_LIMITED,
        "Rate limit exceeded for client '%s'. Try again in %ds"
            .formatted(clientKey, decision.retryAfterSeconds()));
    this.decision = decision;
    withContext("limit", decision.limit());
    withContext("remaining", decision.remaining());
    withContext("retryAfter", decision.retryAfterSeconds());
  }

  public RateLimitDecision getDecision() {
    return decision;
  }
}
