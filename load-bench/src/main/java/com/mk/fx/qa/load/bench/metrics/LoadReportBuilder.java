package com.mk.fx.qa.load.bench.metrics;

import com.mk.fx.qa.load.bench.dto.report.LoadRunReport;
import com.mk.fx.qa.load.bench.executors.paced.PacedLoadResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

final class LoadReportBuilder {

  LoadRunReport build(
      RunConfig config,
      Instant startedAt,
      double elapsedSeconds,
      double achievedRps,
      OutcomeRecorder recorder,
      PacedLoadResult result) {

    var r = new LoadRunReport();

    // identifiers & timing
    r.runId = config.runId();
    r.url = config.url();
    r.method = config.method();
    r.startTime = startedAt;
    r.endTime = Instant.now();
    r.durationSec = Math.max(0.0, elapsedSeconds);

    var env = new LoadRunReport.EnvInfo();
    env.host = EnvironmentInfo.host();
    env.triggeredBy = EnvironmentInfo.triggeredBy();
    r.environment = env;

    var cfg = new LoadRunReport.Config();
    cfg.qps = config.qps();
    cfg.concurrency = config.concurrency();
    cfg.durationSeconds = config.durationSeconds();
    cfg.timeoutSeconds = config.timeoutSeconds();
    cfg.expectedStatus = config.expectedStatus();
    cfg.targetRequestCount = config.targetRequestCount();
    r.config = cfg;

    r.summary = recorder.summarize();

    var details = new LoadRunReport.Details();
    details.achievedRps = achievedRps;
    details.minLatency = recorder.minLatency();
    details.maxLatency = recorder.maxLatency();
    details.transportErrors = recorder.transportErrorCount();
    details.statusMismatches = recorder.statusMismatchCount();
    details.statusBreakdown = new TreeMap<>(recorder.statusBreakdown());
    List<LoadRunReport.ErrorItem> errors = new ArrayList<>();
    for (Map.Entry<String, Long> e : recorder.errorBreakdown().entrySet()) {
      errors.add(new LoadRunReport.ErrorItem(e.getKey(), e.getValue()));
    }
    errors.sort(Comparator.comparingLong((LoadRunReport.ErrorItem i) -> i.count).reversed());
    details.errorBreakdown = List.copyOf(errors);
    details.errorSamples = recorder.errorSamples();
    r.details = details;

    r.completion = computeCompletion(config, r.durationSec, result);
    r.capacityAnalysis = computeCapacity(config.qps(), achievedRps);
    return r;
  }

  private LoadRunReport.Completion computeCompletion(
      RunConfig config, double actualDurationSec, PacedLoadResult result) {
    var c = new LoadRunReport.Completion();
    c.expectedDurationSec = config.durationSeconds();
    c.actualDurationSec = actualDurationSec;
    boolean cancelled = result != null && result.cancelled();
    c.reason = cancelled ? "CANCELLED" : "DURATION_ELAPSED";
    if (result != null) {
      c.workers = result.workers();
      c.iterations = result.iterations();
      c.failedIterations = result.failedIterations();
    }
    c.message =
        cancelled
            ? "Run cancelled before the configured duration elapsed."
            : "Run lasted for the configured duration.";
    return c;
  }

  private LoadRunReport.CapacityAnalysis computeCapacity(double targetRps, double achievedRps) {
    var ca = new LoadRunReport.CapacityAnalysis();
    ca.targetRps = targetRps;
    ca.achievedRps = achievedRps;
    double util = (achievedRps / targetRps) * 100.0;
    ca.utilizationPercent = util;
    if (util < 80.0) {
      ca.assessment = "UNDER_UTILIZED";
      ca.recommendation =
          "Target rate not reached; add workers or check target latency and errors.";
    } else if (util <= 120.0) {
      ca.assessment = "OPTIMAL";
      ca.recommendation = "Achieved rate is close to the target.";
    } else {
      ca.assessment = "OVER_UTILIZED";
      ca.recommendation = "Achieved rate exceeds the target; check rate limiting.";
    }
    return ca;
  }
}
