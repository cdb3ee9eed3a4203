package com.mk.fx.qa.load.bench.ratelimit;

import java.util.function.BooleanSupplier;

/** Admission gate shared by all workers of a run. Bounds the aggregate admission rate. */
public interface RateLimiter {

  /**
   * Blocks until one permit is available and takes it.
   *
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  void acquire() throws InterruptedException;

  /**
   * Like {@link #acquire()}, but gives up waiting once {@code abandon} reports true.
   *
   * @return true if a permit was taken, false if the wait was abandoned
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  default boolean acquire(BooleanSupplier abandon) throws InterruptedException {
    acquire();
    return !abandon.getAsBoolean();
  }

  /** Target admissions per second. */
  double rate();
}
