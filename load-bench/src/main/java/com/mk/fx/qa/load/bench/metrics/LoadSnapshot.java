package com.mk.fx.qa.load.bench.metrics;

/** Immutable snapshot of a run's metrics at a point in time, used for polling. */
public record LoadSnapshot(
    RunConfig config,
    long totalRequests,
    long successfulRequests,
    long errors,
    double achievedRps,
    double elapsedSeconds,
    LoadSummary summary) {}
