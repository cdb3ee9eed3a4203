package com.mk.fx.qa.load.bench.ratelimit;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.mk.fx.qa.load.bench.model.InvalidConfigurationException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Token bucket with continuous, lazily computed refill.
 *
 * <p>The bucket holds at most {@code rate} tokens (one second's worth) and starts empty. Each
 * {@link #acquire()} refills the balance for the time elapsed since the previous update, then
 * either debits one token and returns, or reserves the next token and sleeps until it has
 * accrued. The refill-and-decide step runs under a lock; the sleep happens outside it.
 *
 * <p>A reservation moves {@code lastRefill} forward to the instant the reserved token is fully
 * accrued, so callers arriving during that gap queue behind it instead of being admitted
 * together. Admission order between concurrent callers is not guaranteed.
 *
 * <p>{@link #acquire(BooleanSupplier)} abandons a pending wait within one check slice of its
 * stop condition becoming true.
 */
@Slf4j
public final class TokenBucketRateLimiter implements RateLimiter {

  private static final double NANOS_PER_SECOND = 1_000_000_000d;

  /** Longest single sleep of an abandonable wait; bounds how late a stop is noticed. */
  static final long ABANDON_CHECK_NANOS = TimeUnit.MILLISECONDS.toNanos(20);

  private final double rate;
  private final Ticker ticker;
  private final Sleeper sleeper;
  private final ReentrantLock lock = new ReentrantLock();

  // guarded by lock; always within [0, rate]
  private double tokens;
  // guarded by lock; ahead of the ticker while a reservation is pending
  private long lastRefillNanos;

  public TokenBucketRateLimiter(double rate) {
    this(rate, Ticker.systemTicker(), Sleeper.system());
  }

  @VisibleForTesting
  TokenBucketRateLimiter(double rate, Ticker ticker, Sleeper sleeper) {
    if (!(rate > 0.0) || Double.isInfinite(rate)) {
      throw new InvalidConfigurationException("Rate must be a finite number > 0, was " + rate);
    }
    this.rate = rate;
    this.ticker = Objects.requireNonNull(ticker, "ticker");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.tokens = 0.0;
    this.lastRefillNanos = ticker.read();
    log.debug("Token bucket created with rate={}/s", rate);
  }

  @Override
  public void acquire() throws InterruptedException {
    long waitNanos = reserve();
    if (waitNanos > 0) {
      sleeper.sleepNanos(waitNanos);
    }
  }

  /**
   * Reserves a permit, then sleeps in slices of at most {@link #ABANDON_CHECK_NANOS}, checking
   * {@code abandon} before each one. An abandoned reservation is not returned to the bucket.
   */
  @Override
  public boolean acquire(BooleanSupplier abandon) throws InterruptedException {
    Objects.requireNonNull(abandon, "abandon");
    long remainingNanos = reserve();
    while (remainingNanos > 0) {
      if (abandon.getAsBoolean()) {
        return false;
      }
      long slice = Math.min(ABANDON_CHECK_NANOS, remainingNanos);
      sleeper.sleepNanos(slice);
      remainingNanos -= slice;
    }
    return !abandon.getAsBoolean();
  }

  @Override
  public double rate() {
    return rate;
  }

  /** Refills, then debits or reserves one token. Returns the nanos the caller must wait. */
  private long reserve() {
    lock.lock();
    try {
      long now = ticker.read();
      if (now > lastRefillNanos) {
        double elapsedSeconds = (now - lastRefillNanos) / NANOS_PER_SECOND;
        tokens = Math.min(rate, tokens + elapsedSeconds * rate);
        lastRefillNanos = now;
      }

      if (tokens >= 1.0) {
        tokens -= 1.0;
        return 0L;
      }

      long deficitNanos = (long) Math.ceil((1.0 - tokens) / rate * NANOS_PER_SECOND);
      tokens = 0.0;
      lastRefillNanos += deficitNanos;
      return lastRefillNanos - now;
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  double availableTokens() {
    lock.lock();
    try {
      return tokens;
    } finally {
      lock.unlock();
    }
  }
}
