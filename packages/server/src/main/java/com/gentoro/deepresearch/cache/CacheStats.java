package com.gentoro.deepresearch.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time cache statistics.
 *
 * @param utilization size as a percentage of capacity
 * @param hitRate hits as a percentage of all lookups, 0 when there were none
 */
public record CacheStats(
    @JsonProperty("size") int size,
    @JsonProperty("max_size") int maxSize,
    @JsonProperty("utilization") double utilization,
    @JsonProperty("cache_hits") long hits,
    @JsonProperty("cache_misses") long misses,
    @JsonProperty("total_requests") long totalRequests,
    @JsonProperty("hit_rate") double hitRate) {

  static CacheStats of(int size, int maxSize, long hits, long misses) {
    long total = hits + misses;
    double utilization = maxSize == 0 ? 0.0 : (size * 100.0) / maxSize;
    double hitRate = total == 0 ? 0.0 : (hits * 100.0) / total;
    return new CacheStats(size, maxSize, utilization, hits, misses, total, hitRate);
  }
}
