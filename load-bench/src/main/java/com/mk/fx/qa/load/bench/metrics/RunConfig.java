package com.mk.fx.qa.load.bench.metrics;

import com.mk.fx.qa.load.bench.model.LoadRun;

/**
 * Immutable view of a run's settings used by metrics logging and reporting.
 *
 * @param runId run identifier
 * @param url target URL
 * @param method HTTP method name
 * @param qps target rate
 * @param concurrency worker count
 * @param durationSeconds configured duration
 * @param timeoutSeconds per-request timeout
 * @param expectedStatus status counted as success
 * @param targetRequestCount {@code qps * durationSeconds}, informational
 */
public record RunConfig(
    String runId,
    String url,
    String method,
    double qps,
    int concurrency,
    int durationSeconds,
    int timeoutSeconds,
    int expectedStatus,
    long targetRequestCount) {

  public static RunConfig from(LoadRun run) {
    var d = run.getDefinition();
    return new RunConfig(
        run.getId().toString(),
        d.url(),
        d.method().name(),
        d.qps(),
        d.concurrency(),
        d.durationSeconds(),
        d.timeoutSeconds(),
        d.expectedStatus(),
        d.targetRequestCount());
  }
}
