package com.mk.fx.qa.load.bench.ratelimit;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.base.Ticker;
import com.mk.fx.qa.load.bench.model.InvalidConfigurationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class TokenBucketRateLimiterTest {

  private static final long SECOND = TimeUnit.SECONDS.toNanos(1);

  /** Manual clock; only moves when told to. */
  private static final class FakeTicker extends Ticker {
    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long read() {
      return nanos.get();
    }

    void advance(long delta) {
      nanos.addAndGet(delta);
    }
  }

  @Test
  void emptyBucket_sequentialCallers_arePacedAtRate() throws Exception {
    var ticker = new FakeTicker();
    var limiter = new TokenBucketRateLimiter(10.0, ticker, ticker::advance);

    for (int i = 0; i < 50; i++) {
      limiter.acquire();
      assertTrue(limiter.availableTokens() >= 0.0 && limiter.availableTokens() <= 10.0);
    }

    // 50 admissions at 10/s from an empty bucket take five seconds of clock time
    assertEquals(5 * SECOND, ticker.read());
  }

  @Test
  void idleBucket_refillIsCappedAtOneSecondOfTokens() throws Exception {
    var ticker = new FakeTicker();
    List<Long> waits = new ArrayList<>();
    var limiter =
        new TokenBucketRateLimiter(
            5.0,
            ticker,
            nanos -> {
              waits.add(nanos);
              ticker.advance(nanos);
            });

    ticker.advance(10 * SECOND);
    for (int i = 0; i < 5; i++) {
      limiter.acquire();
    }
    assertTrue(waits.isEmpty(), "a full bucket admits rate tokens without waiting");
    assertEquals(0.0, limiter.availableTokens(), 1e-9);

    limiter.acquire();
    assertEquals(List.of(SECOND / 5), waits);
  }

  @Test
  void waitersArrivingTogether_queueBehindEachOther() throws Exception {
    var ticker = new FakeTicker();
    List<Long> waits = new ArrayList<>();
    // sleeper does not move the clock: all three callers arrive at the same instant
    var limiter = new TokenBucketRateLimiter(10.0, ticker, waits::add);

    limiter.acquire();
    limiter.acquire();
    limiter.acquire();

    long tenth = SECOND / 10;
    assertEquals(List.of(tenth, 2 * tenth, 3 * tenth), waits);
    assertEquals(0.0, limiter.availableTokens(), 1e-9);
  }

  @Test
  void partialBalance_waitsOnlyForTheDeficit() throws Exception {
    var ticker = new FakeTicker();
    List<Long> waits = new ArrayList<>();
    var limiter = new TokenBucketRateLimiter(2.0, ticker, waits::add);

    ticker.advance(SECOND / 4); // accrues half a token
    limiter.acquire();

    assertEquals(List.of(SECOND / 4), waits);
  }

  @Test
  void fractionalRate_isSupported() throws Exception {
    var ticker = new FakeTicker();
    var limiter = new TokenBucketRateLimiter(0.5, ticker, ticker::advance);

    limiter.acquire();
    limiter.acquire();

    assertEquals(4 * SECOND, ticker.read());
    assertTrue(limiter.availableTokens() <= 0.5);
  }

  @Test
  void concurrentCallers_neverExceedRateOverWindow() throws Exception {
    double rate = 50.0;
    var limiter = new TokenBucketRateLimiter(rate);
    int threads = 4;
    Duration window = Duration.ofSeconds(1);
    AtomicInteger admitted = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    long[] deadline = new long[1];
    try {
      for (int t = 0; t < threads; t++) {
        pool.execute(
            () -> {
              try {
                start.await();
                while (true) {
                  limiter.acquire();
                  if (System.nanoTime() > deadline[0]) {
                    return;
                  }
                  admitted.incrementAndGet();
                }
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
      }
      deadline[0] = System.nanoTime() + window.toNanos();
      start.countDown();
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }

    int max = (int) Math.ceil(rate * window.toMillis() / 1000.0) + 2;
    assertTrue(admitted.get() <= max, "admitted " + admitted.get() + " > " + max);
    assertTrue(admitted.get() >= 20, "admitted only " + admitted.get());
  }

  @Test
  void abandonableAcquire_givesUpWhenStopRaised() throws Exception {
    var ticker = new FakeTicker();
    List<Long> waits = new ArrayList<>();
    var stop = new AtomicBoolean(false);
    var limiter =
        new TokenBucketRateLimiter(
            1.0,
            ticker,
            nanos -> {
              waits.add(nanos);
              ticker.advance(nanos);
              if (ticker.read() >= SECOND / 10) {
                stop.set(true);
              }
            });

    assertFalse(limiter.acquire(stop::get));

    // a full second is owed, but the wait stops within one slice of the stop
    long slept = waits.stream().mapToLong(Long::longValue).sum();
    assertTrue(slept < SECOND / 10 + TokenBucketRateLimiter.ABANDON_CHECK_NANOS, "slept " + slept);
    assertTrue(waits.stream().allMatch(w -> w <= TokenBucketRateLimiter.ABANDON_CHECK_NANOS));
  }

  @Test
  void abandonableAcquire_admitsAfterFullWait() throws Exception {
    var ticker = new FakeTicker();
    var limiter = new TokenBucketRateLimiter(10.0, ticker, ticker::advance);

    assertTrue(limiter.acquire(() -> false));
    assertTrue(limiter.acquire(() -> false));

    assertEquals(2 * SECOND / 10, ticker.read());
  }

  @Test
  void abandonableAcquire_stopAlreadyRaised_returnsWithoutSleeping() throws Exception {
    var ticker = new FakeTicker();
    List<Long> waits = new ArrayList<>();
    var limiter = new TokenBucketRateLimiter(1.0, ticker, waits::add);

    assertFalse(limiter.acquire(() -> true));
    assertTrue(waits.isEmpty());
  }

  @Test
  void invalidRates_areRejected() {
    assertThrows(InvalidConfigurationException.class, () -> new TokenBucketRateLimiter(0.0));
    assertThrows(InvalidConfigurationException.class, () -> new TokenBucketRateLimiter(-1.0));
    assertThrows(InvalidConfigurationException.class, () -> new TokenBucketRateLimiter(Double.NaN));
    assertThrows(
        InvalidConfigurationException.class,
        () -> new TokenBucketRateLimiter(Double.POSITIVE_INFINITY));
  }

  @Test
  void interruptedSleep_propagates() {
    var ticker = new FakeTicker();
    var limiter =
        new TokenBucketRateLimiter(
            1.0,
            ticker,
            nanos -> {
              throw new InterruptedException("stop");
            });

    assertThrows(InterruptedException.class, limiter::acquire);
  }
}
