package com.mk.fx.qa.load.bench.metrics;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.bench.dto.report.LoadRunReport;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Thread-safe sink for per-request outcomes of one run.
 *
 * <p>Every mutation and read happens under the recorder's monitor, so
 * {@code totalCount == successCount + errorCount == outcomes().size()} holds at every observation.
 * Outcomes are kept in completion order. {@link #summarize()} only copies state under the monitor;
 * sorting and percentile selection run outside it.
 */
public class OutcomeRecorder {

  private static final int MAX_ERROR_SAMPLES = 5;
  private static final int INITIAL_CAPACITY = 1024;

  private final Consumer<double[]> latencySorter;
  private final List<Outcome> outcomes = new ArrayList<>();
  // latencies in completion order, parallel to outcomes; only [0, totalCount) is populated
  private double[] latencies = new double[INITIAL_CAPACITY];
  private final Map<Integer, Long> statusBreakdown = new TreeMap<>();
  private final Map<String, Long> errorBreakdown = new LinkedHashMap<>();
  private final List<LoadRunReport.ErrorSample> errorSamples = new ArrayList<>();

  private long totalCount;
  private long successCount;
  private long errorCount;
  private long transportErrorCount;
  private double latencySum;
  private double minLatency = Double.MAX_VALUE;
  private double maxLatency;

  public OutcomeRecorder() {
    this(Arrays::sort);
  }

  @VisibleForTesting
  OutcomeRecorder(Consumer<double[]> latencySorter) {
    this.latencySorter = Objects.requireNonNull(latencySorter, "latencySorter");
  }

  /**
   * Records a request that produced a response.
   *
   * @param latencySeconds time from issue to completion, negative values are clamped to zero
   * @param statusCode response status
   * @param expectedStatus status that counts as success
   * @return the recorded outcome
   */
  public synchronized Outcome record(double latencySeconds, int statusCode, int expectedStatus) {
    var result = statusCode == expectedStatus ? OutcomeType.SUCCESS : OutcomeType.STATUS_MISMATCH;
    var outcome = new Outcome(clamp(latencySeconds), result, statusCode, null);
    statusBreakdown.merge(statusCode, 1L, Long::sum);
    append(outcome);
    return outcome;
  }

  /**
   * Records a request that failed to complete. The outcome is a transport error regardless of any
   * status the caller may have seen.
   */
  public synchronized Outcome recordTransportError(double latencySeconds, Throwable error) {
    var type = ErrorClassifier.classify(error);
    var outcome = new Outcome(clamp(latencySeconds), OutcomeType.TRANSPORT_ERROR, null, type);
    transportErrorCount++;
    errorBreakdown.merge(type, 1L, Long::sum);
    if (error != null && errorSamples.size() < MAX_ERROR_SAMPLES) {
      errorSamples.add(ErrorClassifier.sample(type, error));
    }
    append(outcome);
    return outcome;
  }

  private void append(Outcome outcome) {
    outcomes.add(outcome);
    if (totalCount == latencies.length) {
      latencies = Arrays.copyOf(latencies, latencies.length * 2);
    }
    latencies[(int) totalCount] = outcome.latencySeconds();
    totalCount++;
    if (outcome.result() == OutcomeType.SUCCESS) {
      successCount++;
    } else {
      errorCount++;
    }
    latencySum += outcome.latencySeconds();
    minLatency = Math.min(minLatency, outcome.latencySeconds());
    maxLatency = Math.max(maxLatency, outcome.latencySeconds());
  }

  /** Derives the summary snapshot from the outcomes recorded so far. */
  public LoadSummary summarize() {
    double[] sorted;
    long total;
    long successes;
    long errors;
    double sum;
    synchronized (this) {
      if (totalCount == 0) {
        return LoadSummary.empty();
      }
      sorted = Arrays.copyOf(latencies, (int) totalCount);
      total = totalCount;
      successes = successCount;
      errors = errorCount;
      sum = latencySum;
    }
    latencySorter.accept(sorted);
    return new LoadSummary(
        total,
        successes,
        sum / total,
        (double) errors / total,
        (double) successes / total,
        Percentiles.nearestRank(sorted, 50),
        Percentiles.nearestRank(sorted, 90),
        Percentiles.nearestRank(sorted, 95),
        Percentiles.nearestRank(sorted, 99));
  }

  public synchronized long totalCount() {
    return totalCount;
  }

  public synchronized long successCount() {
    return successCount;
  }

  public synchronized long errorCount() {
    return errorCount;
  }

  public synchronized long transportErrorCount() {
    return transportErrorCount;
  }

  public synchronized long statusMismatchCount() {
    return errorCount - transportErrorCount;
  }

  public synchronized double minLatency() {
    return totalCount == 0 ? 0.0 : minLatency;
  }

  public synchronized double maxLatency() {
    return maxLatency;
  }

  public synchronized double averageLatency() {
    return totalCount == 0 ? 0.0 : latencySum / totalCount;
  }

  public synchronized Map<Integer, Long> statusBreakdown() {
    return Map.copyOf(statusBreakdown);
  }

  public synchronized Map<String, Long> errorBreakdown() {
    return Map.copyOf(errorBreakdown);
  }

  public synchronized List<LoadRunReport.ErrorSample> errorSamples() {
    return List.copyOf(errorSamples);
  }

  /** Copy of the recorded outcomes in completion order. */
  public synchronized List<Outcome> outcomes() {
    return List.copyOf(outcomes);
  }

  private static double clamp(double latencySeconds) {
    return Double.isNaN(latencySeconds) ? 0.0 : Math.max(0.0, latencySeconds);
  }
}
