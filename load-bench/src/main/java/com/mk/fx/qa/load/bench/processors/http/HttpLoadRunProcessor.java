package com.mk.fx.qa.load.bench.processors.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mk.fx.qa.load.bench.dto.report.LoadRunReport;
import com.mk.fx.qa.load.bench.executors.paced.PacedLoadExecutor;
import com.mk.fx.qa.load.bench.executors.paced.PacedLoadParameters;
import com.mk.fx.qa.load.bench.executors.paced.PacedLoadResult;
import com.mk.fx.qa.load.bench.metrics.LoadMetricsRegistry;
import com.mk.fx.qa.load.bench.metrics.LoadRunMetrics;
import com.mk.fx.qa.load.bench.metrics.RunConfig;
import com.mk.fx.qa.load.bench.model.LoadRun;
import com.mk.fx.qa.load.bench.processors.LoadRunProcessor;
import com.mk.fx.qa.load.bench.processors.LoadRunValidator;
import com.mk.fx.qa.load.bench.ratelimit.TokenBucketRateLimiter;
import com.mk.fx.qa.load.bench.rest.JsonUtil;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs HTTP load: one {@link TokenBucketRateLimiter}, one outcome recorder and one client per run,
 * driven by {@link PacedLoadExecutor}. The final report is stored in the
 * {@link LoadMetricsRegistry} and logged as JSON.
 */
@Slf4j
@Component
public class HttpLoadRunProcessor implements LoadRunProcessor {

  private final Map<UUID, AtomicBoolean> cancellationTokens = new ConcurrentHashMap<>();
  private final LoadMetricsRegistry metricsRegistry;

  public HttpLoadRunProcessor(LoadMetricsRegistry metricsRegistry) {
    this.metricsRegistry = metricsRegistry;
  }

  @Override
  public LoadRunReport execute(LoadRun run) throws InterruptedException {
    Objects.requireNonNull(run, "Run must not be null");
    var runId = run.getId();
    var cancelled = cancellationTokens.computeIfAbsent(runId, key -> new AtomicBoolean(false));
    try {
      var definition = run.getDefinition();
      var client = LoadRunValidator.buildClient(definition);
      var request = LoadRunValidator.buildRequest(definition);
      LoadRunValidator.validateRequest(client, request);

      if (Thread.interrupted()) {
        throw new InterruptedException("Run " + runId + " cancelled before start");
      }

      var limiter = new TokenBucketRateLimiter(definition.qps());
      var metrics = new LoadRunMetrics(RunConfig.from(run));
      metrics.start();
      metricsRegistry.register(runId, metrics);

      var parameters =
          new PacedLoadParameters(
              definition.concurrency(), Duration.ofSeconds(definition.durationSeconds()));
      var iteration =
          new HttpRequestIteration(
              client, request, definition.expectedStatus(), metrics.getRecorder());

      PacedLoadResult result = null;
      try {
        result = PacedLoadExecutor.execute(runId, parameters, limiter, cancelled::get, iteration);
      } finally {
        metrics.stopAndSummarise();
        metricsRegistry.complete(runId, metrics.snapshotNow());
      }

      var report = metrics.buildReport(result);
      metricsRegistry.saveReport(runId, report);
      try {
        log.info("Run {} report:\n{}", runId, JsonUtil.toJson(report));
      } catch (JsonProcessingException e) {
        log.info("Run {} report (unformatted): {}", runId, report);
      }
      return report;
    } finally {
      cancellationTokens.remove(runId);
    }
  }

  @Override
  public void cancel(UUID runId) {
    var token = cancellationTokens.get(runId);
    if (token != null) {
      token.set(true);
      log.info("Run {} cancellation requested", runId);
    }
  }
}
