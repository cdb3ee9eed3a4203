package com.mk.fx.qa.load.bench.executors.paced;

import java.time.Duration;

/**
 * Parameters for a paced execution.
 *
 * @param concurrency number of workers sharing the rate limiter
 * @param duration wall-clock time the workers run before being asked to stop
 */
public record PacedLoadParameters(int concurrency, Duration duration) {}
