package com.gentoro.deepresearch.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RateLimiterStats(
    @JsonProperty("active_clients") int activeClients,
    @JsonProperty("total_requests_last_window") int totalRecentRequests,
    @JsonProperty("requests_per_window_limit") int limit,
    @JsonProperty("window_seconds") long windowSeconds) {}
