package com.mk.fx.qa.load.bench.executors.paced;

/**
 * One unit of work issued by a worker after it has been admitted by the rate limiter.
 * Implementations record their own outcome; a runtime exception is logged and counted by
 * {@link PacedLoadExecutor} and the worker carries on.
 */
@FunctionalInterface
public interface PacedIteration {
  /**
   * @param workerIndex zero-based index of the calling worker
   * @throws InterruptedException if the worker is interrupted; the worker then stops
   */
  void run(int workerIndex) throws InterruptedException;
}
