package com.gentoro.deepresearch.resilience;

import java.time.Duration;

/** Blocking pause between retry attempts. */
@FunctionalInterface
public interface Sleeper {
  Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

  void sleep(Duration delay) throws InterruptedException;
}
