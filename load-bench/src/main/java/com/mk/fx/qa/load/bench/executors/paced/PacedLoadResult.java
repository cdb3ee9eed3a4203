package com.mk.fx.qa.load.bench.executors.paced;

/**
 * Result of a paced execution.
 *
 * @param workers number of workers started
 * @param iterations iterations that ran to completion
 * @param failedIterations iterations that threw an unexpected exception
 * @param cancelled true if the run stopped early on cancellation or interrupt
 */
public record PacedLoadResult(int workers, long iterations, long failedIterations, boolean cancelled) {}
