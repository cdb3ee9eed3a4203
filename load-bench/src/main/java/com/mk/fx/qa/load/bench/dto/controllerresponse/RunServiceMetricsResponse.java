package com.mk.fx.qa.load.bench.dto.controllerresponse;

/**
 * Aggregate counters across all runs processed by this service instance. The success rate is
 * completed over completed plus failed; cancelled runs are excluded.
 */
public record RunServiceMetricsResponse(
    long totalCompleted,
    long totalFailed,
    long totalCancelled,
    double averageProcessingTimeMillis,
    double successRate,
    long totalProcessed) {}
