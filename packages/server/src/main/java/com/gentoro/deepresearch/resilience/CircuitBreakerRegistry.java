package com.gentoro.deepresearch.resilience;

import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/** One breaker per named dependency, created on first use with shared settings. */
public final class CircuitBreakerRegistry {
  private final CircuitBreakerSettings settings;
  private final Clock clock;
  private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

  public CircuitBreakerRegistry(CircuitBreakerSettings settings) {
    this(settings, Clock.systemUTC());
  }

  public CircuitBreakerRegistry(CircuitBreakerSettings settings, Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public CircuitBreaker breaker(String dependency) {
    return breakers.computeIfAbsent(dependency, n -> new CircuitBreaker(n, settings, clock));
  }

  /** Eagerly create breakers so that they show up in monitoring before first use. */
  public void registerAll(Collection<String> dependencies) {
    dependencies.forEach(this::breaker);
  }

  /** Snapshot of every breaker, ordered by name. */
  public Map<String, CircuitBreakerState> getAllStates() {
    Map<String, CircuitBreakerState> states = new TreeMap<>();
    breakers.forEach((name, breaker) -> states.put(name, breaker.getState()));
    return states;
  }

  public CircuitBreakerSettings settings() {
    return settings;
  }
}
