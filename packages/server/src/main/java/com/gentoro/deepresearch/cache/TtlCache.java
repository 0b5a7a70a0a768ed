package com.gentoro.deepresearch.cache;

import com.gentoro.deepresearch.utility.CheckedSupplier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory cache with per-entry expiry and LRU eviction, used to avoid repeating
 * expensive upstream calls (search plans, search results).
 *
 * <p>All reads and writes of the entry map happen under a single lock owned by the instance. No
 * operation performs I/O or runs caller code while holding it. Eviction always removes the least
 * recently used entry regardless of its remaining TTL.
 *
 * <p>{@link #getOrCompute} coalesces concurrent misses for the same key: the first caller runs the
 * computation and the others wait for its outcome. Failed computations are not cached.
 */
public final class TtlCache<V> {
  private static final org.slf4j.Logger log =
      com.gentoro.deepresearch.logging.LoggingService.getLogger(TtlCache.class);

  private final int maxSize;
  private final Duration defaultTtl;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  // access-order: iteration starts at the least recently used entry
  private final LinkedHashMap<String, CacheEntry<V>> entries =
      new LinkedHashMap<>(16, 0.75f, true);
  private final Map<String, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

  private long hits;
  private long misses;

  public TtlCache(int maxSize, Duration defaultTtl) {
    this(maxSize, defaultTtl, Clock.systemUTC());
  }

  public TtlCache(int maxSize, Duration defaultTtl, Clock clock) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
    }
    if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
      throw new IllegalArgumentException("defaultTtl must be positive: " + defaultTtl);
    }
    this.maxSize = maxSize;
    this.defaultTtl = defaultTtl;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Return the value for {@code key} if present and unexpired, marking it most recently used. An
   * expired entry is removed and the lookup counts as a miss.
   */
  public Optional<V> get(String key) {
    lock.lock();
    try {
      CacheEntry<V> entry = entries.get(key);
      if (entry == null) {
        misses++;
        return Optional.empty();
      }
      if (entry.isExpired(clock.instant())) {
        entries.remove(key);
        misses++;
        return Optional.empty();
      }
      entry.hits++;
      hits++;
      return Optional.of(entry.value);
    } finally {
      lock.unlock();
    }
  }

  /** Store {@code value} with the default TTL. */
  public void set(String key, V value) {
    set(key, value, null);
  }

  /**
   * Store {@code value} under {@code key}. A {@code null}, zero or negative {@code ttl} means the
   * default TTL. When the cache is full and the key is new, the least recently used entry is
   * evicted first.
   */
  public void set(String key, V value, Duration ttl) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    Duration effective = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;

    lock.lock();
    try {
      Instant now = clock.instant();
      if (entries.size() >= maxSize && !entries.containsKey(key)) {
        Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
          String evicted = it.next().getKey();
          it.remove();
          log.debug("Evicted least recently used key {}", evicted);
        }
      }
      entries.put(key, new CacheEntry<>(value, now, now.plus(effective)));
    } finally {
      lock.unlock();
    }
  }

  /** Remove {@code key}. Returns whether an entry was present. */
  public boolean delete(String key) {
    lock.lock();
    try {
      return entries.remove(key) != null;
    } finally {
      lock.unlock();
    }
  }

  /** Drop every entry and reset the hit/miss counters. */
  public void clear() {
    lock.lock();
    try {
      entries.clear();
      hits = 0;
      misses = 0;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Return the cached value, or run {@code computeFn}, store a non-null result with {@code ttl} and
   * return it. Concurrent callers missing on the same key share one computation; if it fails, each
   * of them receives the failure.
   */
  public V getOrCompute(String key, CheckedSupplier<V> computeFn, Duration ttl) throws Exception {
    Optional<V> cached = get(key);
    if (cached.isPresent()) {
      return cached.get();
    }

    CompletableFuture<V> mine = new CompletableFuture<>();
    CompletableFuture<V> running = inFlight.putIfAbsent(key, mine);
    if (running != null) {
      log.debug("Waiting for in-flight computation of {}", key);
      return await(running);
    }

    try {
      // A computation may have finished between our miss and registering as the owner.
      Optional<V> raced = peek(key);
      if (raced.isPresent()) {
        mine.complete(raced.get());
        return raced.get();
      }
      V value = computeFn.get();
      if (value != null) {
        set(key, value, ttl);
      }
      mine.complete(value);
      return value;
    } catch (Throwable t) {
      mine.completeExceptionally(t);
      throw t;
    } finally {
      inFlight.remove(key, mine);
    }
  }

  /** Remove every expired entry. Returns the number removed. */
  public int cleanupExpired() {
    lock.lock();
    try {
      Instant now = clock.instant();
      int removed = 0;
      for (Iterator<CacheEntry<V>> it = entries.values().iterator(); it.hasNext(); ) {
        if (it.next().isExpired(now)) {
          it.remove();
          removed++;
        }
      }
      if (removed > 0) {
        log.debug("Removed {} expired cache entries", removed);
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  public CacheStats getStats() {
    lock.lock();
    try {
      return CacheStats.of(entries.size(), maxSize, hits, misses);
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public int maxSize() {
    return maxSize;
  }

  public Duration defaultTtl() {
    return defaultTtl;
  }

  /** Lookup that leaves the hit/miss counters untouched. */
  private Optional<V> peek(String key) {
    CacheEntry<V> entry = liveEntry(key);
    return entry == null ? Optional.empty() : Optional.of(entry.value);
  }

  /** The unexpired entry for {@code key}, or null. Does not count as a lookup. */
  CacheEntry<V> liveEntry(String key) {
    lock.lock();
    try {
      CacheEntry<V> entry = entries.get(key);
      if (entry == null || entry.isExpired(clock.instant())) {
        return null;
      }
      return entry;
    } finally {
      lock.unlock();
    }
  }

  private static <V> V await(CompletableFuture<V> future) throws Exception {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception ex) throw ex;
      if (cause instanceof Error err) throw err;
      throw e;
    }
  }
}
