package com.mk.fx.qa.load.bench.metrics;

import com.mk.fx.qa.load.bench.cfg.RunProcessingCfg;
import com.mk.fx.qa.load.bench.dto.report.LoadRunReport;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Thread-safe registry for run metrics and reports.
 *
 * <p>Tracks the {@link LoadRunMetrics} of active runs, serves live or final snapshots and stores
 * final {@link LoadRunReport} instances. Final snapshots and reports are kept for the most recent
 * {@code load.runs.history-size} finished runs; older ones are evicted together.
 */
@Slf4j
@Component
public class LoadMetricsRegistry {

  static final int DEFAULT_RETAINED_RUNS = 50;

  private final int retainedRuns;
  private final Map<UUID, LoadRunMetrics> active = new ConcurrentHashMap<>();
  private final Map<UUID, LoadSnapshot> completed = new ConcurrentHashMap<>();
  private final Map<UUID, LoadRunReport> reports = new ConcurrentHashMap<>();
  // finished run ids, newest first
  private final Deque<UUID> finished = new ConcurrentLinkedDeque<>();

  public LoadMetricsRegistry() {
    this(DEFAULT_RETAINED_RUNS);
  }

  @Autowired
  public LoadMetricsRegistry(RunProcessingCfg properties) {
    this(properties.getHistorySize());
  }

  LoadMetricsRegistry(int retainedRuns) {
    if (retainedRuns < 1) {
      throw new IllegalArgumentException("retainedRuns must be positive: " + retainedRuns);
    }
    this.retainedRuns = retainedRuns;
  }

  public void register(UUID runId, LoadRunMetrics metrics) {
    active.put(runId, metrics);
  }

  /** Stores the final snapshot and removes the run from the active set. */
  public void complete(UUID runId, LoadSnapshot finalSnapshot) {
    completed.put(runId, finalSnapshot);
    active.remove(runId);
    retain(runId);
  }

  /** Live snapshot for an active run, else the final one, else empty. */
  public Optional<LoadSnapshot> getSnapshot(UUID runId) {
    var metrics = active.get(runId);
    if (metrics != null) {
      return Optional.of(metrics.snapshotNow());
    }
    return Optional.ofNullable(completed.get(runId));
  }

  public void saveReport(UUID runId, LoadRunReport report) {
    reports.put(runId, report);
    retain(runId);
  }

  public Optional<LoadRunReport> getReport(UUID runId) {
    return Optional.ofNullable(reports.get(runId));
  }

  private synchronized void retain(UUID runId) {
    if (finished.contains(runId)) {
      return;
    }
    finished.addFirst(runId);
    while (finished.size() > retainedRuns) {
      var evicted = finished.pollLast();
      completed.remove(evicted);
      reports.remove(evicted);
      log.debug("Evicted final metrics of run {}", evicted);
    }
  }
}
