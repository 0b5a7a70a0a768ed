package com.gentoro.deepresearch.cache;

import java.time.Instant;

/** A cached value with its lifetime and hit count. Only ever touched under the owning cache's lock. */
final class CacheEntry<V> {
  final V value;
  final Instant createdAt;
  final Instant expiresAt;
  long hits;

  CacheEntry(V value, Instant createdAt, Instant expiresAt) {
    this.value = value;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
  }

  boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
