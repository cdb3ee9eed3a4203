package com.mk.fx.qa.load.bench.dto.report;

import com.mk.fx.qa.load.bench.metrics.LoadSummary;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;

/**
 * Final report of a run: identity, timing, configuration, the summary snapshot and the detail
 * derived from the recorded outcomes.
 */
public class LoadRunReport {

  public String runId;
  public String url;
  public String method;
  public Instant startTime;
  public Instant endTime;
  public double durationSec;

  public EnvInfo environment;
  public Config config;
  public LoadSummary summary;
  public Details details;
  public Completion completion;
  public CapacityAnalysis capacityAnalysis;

  public static class EnvInfo {
    public String host;
    public String triggeredBy;
  }

  public static class Config {
    public double qps;
    public int concurrency;
    public int durationSeconds;
    public int timeoutSeconds;
    public int expectedStatus;
    public long targetRequestCount;
  }

  public static class Details {
    public double achievedRps;
    public double minLatency;
    public double maxLatency;
    public long transportErrors;
    public long statusMismatches;
    public Map<Integer, Long> statusBreakdown;
    public List<ErrorItem> errorBreakdown;
    public List<ErrorSample> errorSamples;
  }

  @NoArgsConstructor
  @AllArgsConstructor
  public static class ErrorSample {
    public String type;
    public String message;
    public List<String> stack;
  }

  @NoArgsConstructor
  @AllArgsConstructor
  public static class ErrorItem {
    public String type;
    public long count;
  }

  public static class Completion {
    public String reason; // DURATION_ELAPSED, CANCELLED
    public double expectedDurationSec;
    public double actualDurationSec;
    public int workers;
    public long iterations;
    public long failedIterations;
    public String message;
  }

  public static class CapacityAnalysis {
    public double targetRps;
    public double achievedRps;
    public double utilizationPercent;
    public String assessment; // UNDER_UTILIZED, OPTIMAL, OVER_UTILIZED
    public String recommendation;
  }
}
