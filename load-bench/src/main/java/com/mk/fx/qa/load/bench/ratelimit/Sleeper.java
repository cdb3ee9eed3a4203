package com.mk.fx.qa.load.bench.ratelimit;

import java.util.concurrent.TimeUnit;

/** Suspends the calling thread. Swapped for a clock-advancing fake in tests. */
@FunctionalInterface
public interface Sleeper {

  void sleepNanos(long nanos) throws InterruptedException;

  static Sleeper system() {
    return TimeUnit.NANOSECONDS::sleep;
  }
}
