package com.mk.fx.qa.load.bench.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.bench.executors.paced.PacedLoadResult;
import java.net.ConnectException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class LoadRunMetricsTest {

  private static RunConfig config(double qps) {
    return new RunConfig(
        UUID.randomUUID().toString(), "http://localhost/ping", "GET", qps, 2, 10, 5, 200, 100);
  }

  @Test
  void buildReport_carriesSummaryAndDetails() {
    var recorder = new OutcomeRecorder();
    recorder.record(0.1, 200, 200);
    recorder.record(0.3, 404, 200);
    recorder.recordTransportError(1.0, new ConnectException("refused"));
    var cfg = config(10.0);

    var report =
        new LoadReportBuilder()
            .build(cfg, Instant.now(), 10.0, 10.0, recorder, new PacedLoadResult(2, 3, 0, false));

    assertEquals(cfg.runId(), report.runId);
    assertEquals("GET", report.method);
    assertEquals(3, report.summary.totalRequests());
    assertEquals(1, report.summary.successfulRequests());
    assertEquals(1, report.details.transportErrors);
    assertEquals(1, report.details.statusMismatches);
    assertEquals(0.1, report.details.minLatency);
    assertEquals(1.0, report.details.maxLatency);
    assertEquals(1L, report.details.statusBreakdown.get(404));
    assertEquals("CONNECTION_REFUSED", report.details.errorBreakdown.get(0).type);
    assertEquals("DURATION_ELAPSED", report.completion.reason);
    assertEquals(2, report.completion.workers);
    assertEquals(100, report.config.targetRequestCount);
  }

  @Test
  void buildReport_cancelledRun() {
    var report =
        new LoadReportBuilder()
            .build(
                config(10.0),
                Instant.now(),
                1.0,
                0.0,
                new OutcomeRecorder(),
                new PacedLoadResult(2, 0, 0, true));

    assertEquals("CANCELLED", report.completion.reason);
    assertEquals(LoadSummary.empty(), report.summary);
  }

  @Test
  void capacity_assessmentByUtilization() {
    var builder = new LoadReportBuilder();
    var recorder = new OutcomeRecorder();
    var result = new PacedLoadResult(1, 0, 0, false);

    assertEquals(
        "UNDER_UTILIZED",
        builder.build(config(10.0), Instant.now(), 1, 5.0, recorder, result)
            .capacityAnalysis
            .assessment);
    assertEquals(
        "OPTIMAL",
        builder.build(config(10.0), Instant.now(), 1, 9.9, recorder, result)
            .capacityAnalysis
            .assessment);
    assertEquals(
        "OVER_UTILIZED",
        builder.build(config(10.0), Instant.now(), 1, 13.0, recorder, result)
            .capacityAnalysis
            .assessment);
  }

  @Test
  void snapshot_reflectsRecorder() {
    var metrics = new LoadRunMetrics(config(5.0));
    metrics.getRecorder().record(0.1, 200, 200);
    metrics.getRecorder().record(0.1, 500, 200);

    var snapshot = metrics.snapshotNow();

    assertEquals(2, snapshot.totalRequests());
    assertEquals(1, snapshot.successfulRequests());
    assertEquals(1, snapshot.errors());
    assertTrue(snapshot.achievedRps() > 0);
    assertDoesNotThrow(metrics::logProgress);
  }

  @Test
  void registry_servesLiveThenFinalSnapshot() {
    var registry = new LoadMetricsRegistry();
    var cfg = config(5.0);
    var id = UUID.fromString(cfg.runId());
    var metrics = new LoadRunMetrics(cfg);

    assertTrue(registry.getSnapshot(id).isEmpty());
    registry.register(id, metrics);
    metrics.getRecorder().record(0.1, 200, 200);
    assertEquals(1, registry.getSnapshot(id).orElseThrow().totalRequests());

    var last = metrics.snapshotNow();
    registry.complete(id, last);
    metrics.getRecorder().record(0.1, 200, 200);
    assertEquals(1, registry.getSnapshot(id).orElseThrow().totalRequests());
  }

  @Test
  void registry_evictsOldestFinishedRuns() {
    var registry = new LoadMetricsRegistry(2);
    var ids = new ArrayList<UUID>();
    for (int i = 0; i < 3; i++) {
      var cfg = config(5.0);
      var id = UUID.fromString(cfg.runId());
      var metrics = new LoadRunMetrics(cfg);
      metrics.getRecorder().record(0.1, 200, 200);
      registry.register(id, metrics);
      registry.complete(id, metrics.snapshotNow());
      registry.saveReport(
          id,
          new LoadReportBuilder()
              .build(
                  cfg,
                  Instant.now(),
                  1.0,
                  1.0,
                  metrics.getRecorder(),
                  new PacedLoadResult(1, 1, 0, false)));
      ids.add(id);
    }

    assertTrue(registry.getSnapshot(ids.get(0)).isEmpty());
    assertTrue(registry.getReport(ids.get(0)).isEmpty());
    assertTrue(registry.getSnapshot(ids.get(1)).isPresent());
    assertTrue(registry.getReport(ids.get(2)).isPresent());
  }

  @Test
  void registry_activeRunsAreNeverEvicted() {
    var registry = new LoadMetricsRegistry(1);
    var running = config(5.0);
    var runningId = UUID.fromString(running.runId());
    registry.register(runningId, new LoadRunMetrics(running));

    for (int i = 0; i < 3; i++) {
      var cfg = config(5.0);
      var metrics = new LoadRunMetrics(cfg);
      registry.complete(UUID.fromString(cfg.runId()), metrics.snapshotNow());
    }

    assertTrue(registry.getSnapshot(runningId).isPresent());
  }
}
