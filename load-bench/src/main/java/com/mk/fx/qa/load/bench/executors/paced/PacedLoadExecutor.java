package com.mk.fx.qa.load.bench.executors.paced;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.load.bench.ratelimit.RateLimiter;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a fixed pool of workers for a fixed wall-clock duration. Every worker loops: acquire a
 * token from the shared {@link RateLimiter}, run one {@link PacedIteration}, repeat until the stop
 * flag is raised.
 *
 * <p>The calling thread waits out the duration in short chunks so that external cancellation or an
 * interrupt ends the run early. Either way the stop flag is raised once and the workers are drained
 * cooperatively: a worker waiting for a token abandons the wait, an iteration already in progress
 * is never interrupted.
 */
@Slf4j
public final class PacedLoadExecutor {

  private static final long SLEEP_CHUNK_MILLIS = 100L;
  private static final long DRAIN_WARN_SECONDS = 5L;

  private PacedLoadExecutor() {
    throw new UnsupportedOperationException("PacedLoadExecutor cannot be instantiated");
  }

  /**
   * Runs a paced execution and blocks until every worker has stopped.
   *
   * <p>If the calling thread is interrupted, the run is stopped and drained, the result is marked
   * cancelled and the interrupt flag is restored before returning.
   *
   * @param runId run identifier used for thread names and logs
   * @param parameters worker count and duration
   * @param rateLimiter admission gate shared by all workers
   * @param cancellationRequested supplier checked for cooperative cancellation
   * @param iteration work issued once per admitted token
   * @return worker and iteration counts plus the cancellation flag
   * @throws IllegalArgumentException if concurrency or duration is not positive
   */
  public static PacedLoadResult execute(
      UUID runId,
      PacedLoadParameters parameters,
      RateLimiter rateLimiter,
      BooleanSupplier cancellationRequested,
      PacedIteration iteration) {
    validate(runId, parameters, rateLimiter, cancellationRequested, iteration);

    int workers = parameters.concurrency();
    var stopRequested = new AtomicBoolean(false);
    var busyWorkers = new AtomicInteger();
    var iterations = new AtomicLong();
    var failedIterations = new AtomicLong();

    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("paced-load-" + runId + "-worker-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };

    ExecutorService pool = newFixedThreadPool(workers, threadFactory);
    log.info(
        "Run {} starting {} workers at {}/s for {}",
        runId,
        workers,
        rateLimiter.rate(),
        parameters.duration());
    for (int workerIndex = 0; workerIndex < workers; workerIndex++) {
      final int current = workerIndex;
      pool.execute(
          () ->
              runWorker(
                  runId,
                  current,
                  rateLimiter,
                  iteration,
                  stopRequested,
                  busyWorkers,
                  iterations,
                  failedIterations));
    }

    boolean cancelled;
    boolean interrupted = false;
    try {
      cancelled = awaitDuration(parameters.duration(), cancellationRequested);
    } catch (InterruptedException e) {
      cancelled = true;
      interrupted = true;
    }

    stopRequested.set(true);
    log.info("Run {} stop requested{}", runId, cancelled ? " (cancelled)" : "");
    pool.shutdown();
    interrupted |= drain(runId, pool, busyWorkers);
    if (interrupted) {
      Thread.currentThread().interrupt();
    }

    log.info(
        "Run {} workers stopped: iterations={}, failedIterations={}",
        runId,
        iterations.get(),
        failedIterations.get());
    return new PacedLoadResult(workers, iterations.get(), failedIterations.get(), cancelled);
  }

  private static void validate(
      UUID runId,
      PacedLoadParameters parameters,
      RateLimiter rateLimiter,
      BooleanSupplier cancellationRequested,
      PacedIteration iteration) {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(rateLimiter, "rateLimiter");
    Objects.requireNonNull(cancellationRequested, "cancellationRequested");
    Objects.requireNonNull(iteration, "iteration");
    if (parameters.concurrency() <= 0) {
      throw new IllegalArgumentException("concurrency must be > 0");
    }
    if (parameters.duration() == null
        || parameters.duration().isNegative()
        || parameters.duration().isZero()) {
      throw new IllegalArgumentException("duration must be > 0");
    }
  }

  private static void runWorker(
      UUID runId,
      int workerIndex,
      RateLimiter rateLimiter,
      PacedIteration iteration,
      AtomicBoolean stopRequested,
      AtomicInteger busyWorkers,
      AtomicLong iterations,
      AtomicLong failedIterations) {
    log.debug("Run {} worker {} started", runId, workerIndex + 1);
    try {
      while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
        if (!rateLimiter.acquire(stopRequested::get) || stopRequested.get()) {
          break;
        }
        busyWorkers.incrementAndGet();
        try {
          iteration.run(workerIndex);
          iterations.incrementAndGet();
        } catch (RuntimeException ex) {
          failedIterations.incrementAndGet();
          log.error(
              "Run {} worker {} iteration failed: {}", runId, workerIndex + 1, ex.getMessage(), ex);
        } finally {
          busyWorkers.decrementAndGet();
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.debug("Run {} worker {} interrupted", runId, workerIndex + 1);
    }
    log.debug("Run {} worker {} stopped", runId, workerIndex + 1);
  }

  /** Sleeps for the duration in chunks. Returns true if cancellation ended the wait early. */
  private static boolean awaitDuration(Duration duration, BooleanSupplier cancellationRequested)
      throws InterruptedException {
    long deadline = System.nanoTime() + duration.toNanos();
    while (true) {
      if (cancellationRequested.getAsBoolean()) {
        return true;
      }
      long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      if (remainingMillis <= 0) {
        return false;
      }
      TimeUnit.MILLISECONDS.sleep(Math.min(SLEEP_CHUNK_MILLIS, remainingMillis));
    }
  }

  /**
   * Waits for every worker to finish its current iteration, warning periodically while some are
   * still busy. Returns true if the calling thread was interrupted while waiting.
   */
  private static boolean drain(UUID runId, ExecutorService pool, AtomicInteger busyWorkers) {
    boolean interrupted = false;
    while (true) {
      try {
        if (pool.awaitTermination(DRAIN_WARN_SECONDS, TimeUnit.SECONDS)) {
          return interrupted;
        }
        log.warn(
            "Run {} still waiting for {} busy worker(s) to finish in-flight requests",
            runId,
            busyWorkers.get());
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
  }
}
