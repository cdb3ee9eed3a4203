package com.mk.fx.qa.load.bench.metrics;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.bench.dto.report.LoadRunReport;
import com.mk.fx.qa.load.bench.executors.paced.PacedLoadResult;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Metrics of one run: owns the run's {@link OutcomeRecorder}, logs progress every five seconds
 * while the run is active and builds the final report.
 */
@Slf4j
public class LoadRunMetrics {

  private static final long PROGRESS_INTERVAL_SECONDS = 5L;

  @Getter private final RunConfig config;
  @Getter private final OutcomeRecorder recorder;
  @Getter private final Instant startedAt = Instant.now();
  private final long startNanos = System.nanoTime();

  private ScheduledExecutorService progress;

  public LoadRunMetrics(RunConfig config) {
    this(config, new OutcomeRecorder());
  }

  public LoadRunMetrics(RunConfig config, OutcomeRecorder recorder) {
    this.config = Objects.requireNonNull(config, "config");
    this.recorder = Objects.requireNonNull(recorder, "recorder");
  }

  public void start() {
    log.info(
        "Run {} started: method={}, url={}, qps={}, concurrency={}, duration={}s, timeout={}s,"
            + " expectedStatus={}, targetRequests={}",
        config.runId(),
        config.method(),
        config.url(),
        config.qps(),
        config.concurrency(),
        config.durationSeconds(),
        config.timeoutSeconds(),
        config.expectedStatus(),
        config.targetRequestCount());
    progress =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("run-progress-" + config.runId());
              t.setDaemon(true);
              return t;
            });
    progress.scheduleAtFixedRate(
        this::logProgress,
        PROGRESS_INTERVAL_SECONDS,
        PROGRESS_INTERVAL_SECONDS,
        TimeUnit.SECONDS);
  }

  /** Stops progress logging and logs the final summary line. */
  public void stopAndSummarise() {
    if (progress != null) {
      progress.shutdownNow();
      try {
        progress.awaitTermination(2, TimeUnit.SECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      }
    }
    var summary = recorder.summarize();
    log.info(
        "Run {} summary: totalRequests={}, successfulRequests={}, targetRequests={},"
            + " rps actual/expected={}/{}, avgLatency={}s, p50={}s, p90={}s, p95={}s, p99={}s,"
            + " errorRate={}",
        config.runId(),
        summary.totalRequests(),
        summary.successfulRequests(),
        config.targetRequestCount(),
        format(achievedRps()),
        format(config.qps()),
        format(summary.averageLatency()),
        format(summary.p50()),
        format(summary.p90()),
        format(summary.p95()),
        format(summary.p99()),
        format(summary.errorRate()));
  }

  @VisibleForTesting
  void logProgress() {
    var sb = new StringBuilder();
    sb.append("Run ")
        .append(config.runId())
        .append(" progress: requests=")
        .append(recorder.totalCount())
        .append("/")
        .append(config.targetRequestCount())
        .append(", rps actual/expected=")
        .append(format(achievedRps()))
        .append("/")
        .append(format(config.qps()))
        .append(", success=")
        .append(recorder.successCount())
        .append(", errors=")
        .append(recorder.errorCount());
    if (recorder.totalCount() > 0) {
      sb.append(", lat(s) min=")
          .append(format(recorder.minLatency()))
          .append(", avg=")
          .append(format(recorder.averageLatency()))
          .append(", max=")
          .append(format(recorder.maxLatency()));
    }
    log.info(sb.toString());
  }

  public LoadSnapshot snapshotNow() {
    var summary = recorder.summarize();
    return new LoadSnapshot(
        config,
        summary.totalRequests(),
        summary.successfulRequests(),
        summary.totalRequests() - summary.successfulRequests(),
        achievedRps(),
        elapsedSeconds(),
        summary);
  }

  public LoadRunReport buildReport(PacedLoadResult result) {
    return new LoadReportBuilder()
        .build(config, startedAt, elapsedSeconds(), achievedRps(), recorder, result);
  }

  public double achievedRps() {
    return recorder.totalCount() / Math.max(0.001, elapsedSeconds());
  }

  private double elapsedSeconds() {
    return (System.nanoTime() - startNanos) / 1_000_000_000.0;
  }

  private static String format(double value) {
    return String.format("%.3f", value);
  }
}
