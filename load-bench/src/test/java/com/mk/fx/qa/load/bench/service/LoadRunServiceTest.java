package com.mk.fx.qa.load.bench.service;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.bench.cfg.RunProcessingCfg;
import com.mk.fx.qa.load.bench.dto.controllerresponse.RunStatusResponse;
import com.mk.fx.qa.load.bench.dto.report.LoadRunReport;
import com.mk.fx.qa.load.bench.model.InvalidConfigurationException;
import com.mk.fx.qa.load.bench.model.LoadRun;
import com.mk.fx.qa.load.bench.model.LoadRunDefinition;
import com.mk.fx.qa.load.bench.model.RunStatus;
import com.mk.fx.qa.load.bench.processors.LoadRunProcessor;
import com.mk.fx.qa.load.bench.rest.HttpMethod;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class LoadRunServiceTest {

  private static LoadRun newRun() {
    return newRun(UUID.randomUUID(), "http://localhost:8080/health");
  }

  private static LoadRun newRun(UUID id, String url) {
    return new LoadRun(
        id,
        Instant.now(),
        new LoadRunDefinition(url, HttpMethod.GET, 5, 1, 1, 1, null, null, 200, null));
  }

  private static RunProcessingCfg cfg(int concurrency, int history) {
    RunProcessingCfg cfg = new RunProcessingCfg();
    cfg.setConcurrency(concurrency);
    cfg.setHistorySize(history);
    return cfg;
  }

  private static void awaitStatus(LoadRunService service, UUID id, RunStatus status) {
    await()
        .atMost(Duration.ofSeconds(5))
        .pollInterval(Duration.ofMillis(20))
        .until(
            () -> service.getRunStatus(id).map(RunStatusResponse::status).orElse(null) == status);
  }

  private static LoadRunReport report(String reason) {
    var report = new LoadRunReport();
    report.completion = new LoadRunReport.Completion();
    report.completion.reason = reason;
    return report;
  }

  @Test
  void submitRun_successfulExecution_updatesStatusAndMetrics() {
    var processor = new CountingProcessor();
    var service = new LoadRunService(cfg(1, 10), processor);
    var run = newRun();

    var outcome = service.submitRun(run).orElseThrow();
    assertEquals(run.getId(), outcome.runId());
    assertNotEquals(RunStatus.ERROR, outcome.status());

    awaitStatus(service, run.getId(), RunStatus.COMPLETED);

    assertEquals(1, processor.executions.get());
    var status = service.getRunStatus(run.getId()).orElseThrow();
    assertNotNull(status.startedAt());
    assertNotNull(status.completedAt());
    await().atMost(Duration.ofSeconds(2)).until(() -> service.getMetrics().totalCompleted() == 1);
    var metrics = service.getMetrics();
    assertEquals(1, metrics.totalCompleted());
    assertEquals(0, metrics.totalFailed());
    assertEquals(1.0, metrics.successRate(), 1e-9);
    await().atMost(Duration.ofSeconds(2)).until(() -> service.getRunHistory().size() == 1);
  }

  @Test
  void submitRun_invalidDefinition_isRejectedBeforeQueueing() {
    var service = new LoadRunService(cfg(1, 10), new CountingProcessor());
    var run = newRun(UUID.randomUUID(), "not a url");

    assertThrows(InvalidConfigurationException.class, () -> service.submitRun(run));
    assertTrue(service.getRunStatus(run.getId()).isEmpty());
  }

  @Test
  void submitRun_duplicateId_returnsError() {
    var processor = new BlockingProcessor();
    var service = new LoadRunService(cfg(1, 10), processor);
    var id = UUID.randomUUID();

    service.submitRun(newRun(id, "http://localhost/a"));
    var duplicate = service.submitRun(newRun(id, "http://localhost/b")).orElseThrow();

    assertEquals(RunStatus.ERROR, duplicate.status());
    assertTrue(duplicate.message().contains("already exists"));
    processor.release.countDown();
  }

  @Test
  void submitRun_processorFailure_marksError() {
    var service =
        new LoadRunService(
            cfg(1, 10),
            new LoadRunProcessor() {
              @Override
              public LoadRunReport execute(LoadRun run) {
                throw new IllegalStateException("target exploded");
              }

              @Override
              public void cancel(UUID runId) {}
            });
    var run = newRun();

    service.submitRun(run);
    awaitStatus(service, run.getId(), RunStatus.ERROR);

    var status = service.getRunStatus(run.getId()).orElseThrow();
    assertEquals("target exploded", status.errorMessage());
    await().atMost(Duration.ofSeconds(2)).until(() -> service.getMetrics().totalFailed() == 1);
    assertTrue(service.isHealthy());
  }

  @Test
  void submitRun_cancelledReport_marksCancelled() {
    var service =
        new LoadRunService(
            cfg(1, 10),
            new LoadRunProcessor() {
              @Override
              public LoadRunReport execute(LoadRun run) {
                return report("CANCELLED");
              }

              @Override
              public void cancel(UUID runId) {}
            });
    var run = newRun();

    service.submitRun(run);
    awaitStatus(service, run.getId(), RunStatus.CANCELLED);

    await().atMost(Duration.ofSeconds(2)).until(() -> service.getMetrics().totalCancelled() == 1);
  }

  @Test
  void cancelRun_whenQueued_cancelsImmediately() throws Exception {
    var processor = new BlockingProcessor();
    var service = new LoadRunService(cfg(1, 10), processor);
    var first = newRun();
    var second = newRun();

    service.submitRun(first);
    assertTrue(processor.started.await(2, TimeUnit.SECONDS));
    service.submitRun(second);

    var result = service.cancelRun(second.getId());
    assertEquals(LoadRunService.CancellationResult.CancellationState.CANCELLED, result.getState());
    assertEquals(RunStatus.CANCELLED, result.getRunStatus());
    awaitStatus(service, second.getId(), RunStatus.CANCELLED);

    processor.release.countDown();
    awaitStatus(service, first.getId(), RunStatus.COMPLETED);
    assertEquals(1, processor.executions.get());
    assertEquals(1, service.getMetrics().totalCancelled());
  }

  @Test
  void cancelRun_whenProcessing_requestsCancellation() throws Exception {
    var processor = new BlockingProcessor();
    var service = new LoadRunService(cfg(1, 10), processor);
    var run = newRun();

    service.submitRun(run);
    assertTrue(processor.started.await(2, TimeUnit.SECONDS));

    var result = service.cancelRun(run.getId());

    assertEquals(
        LoadRunService.CancellationResult.CancellationState.CANCELLATION_REQUESTED,
        result.getState());
    assertTrue(processor.cancelRequested.get());
    awaitStatus(service, run.getId(), RunStatus.CANCELLED);
  }

  @Test
  void cancelRun_unknownOrFinished() {
    var service = new LoadRunService(cfg(1, 10), new CountingProcessor());
    var run = newRun();

    assertEquals(
        LoadRunService.CancellationResult.CancellationState.NOT_FOUND,
        service.cancelRun(UUID.randomUUID()).getState());

    service.submitRun(run);
    awaitStatus(service, run.getId(), RunStatus.COMPLETED);
    var result = service.cancelRun(run.getId());

    assertEquals(
        LoadRunService.CancellationResult.CancellationState.NOT_CANCELLABLE, result.getState());
    assertEquals(RunStatus.COMPLETED, result.getRunStatus());
  }

  @Test
  void history_isBoundedNewestFirst() {
    var service = new LoadRunService(cfg(1, 2), new CountingProcessor());
    var a = newRun();
    var b = newRun();
    var c = newRun();

    service.submitRun(a);
    awaitStatus(service, a.getId(), RunStatus.COMPLETED);
    service.submitRun(b);
    awaitStatus(service, b.getId(), RunStatus.COMPLETED);
    service.submitRun(c);
    awaitStatus(service, c.getId(), RunStatus.COMPLETED);
    await()
        .atMost(Duration.ofSeconds(2))
        .until(() -> service.getRunHistory().get(0).runId().equals(c.getId()));

    var history = service.getRunHistory();
    assertEquals(2, history.size());
    assertEquals(c.getId(), history.get(0).runId());
    assertEquals(b.getId(), history.get(1).runId());
    assertEquals(3, service.getAllRuns().size());
    assertEquals(3, service.getRunsByStatus(RunStatus.COMPLETED).size());
    assertTrue(service.getRunsByStatus(RunStatus.QUEUED).isEmpty());
  }

  @Test
  void shutdown_stopsAcceptingRuns() {
    var service = new LoadRunService(cfg(1, 10), new CountingProcessor());

    service.shutdown();

    assertTrue(service.submitRun(newRun()).isEmpty());
    assertFalse(service.isHealthy());
    assertFalse(service.getQueueStatus().acceptingRuns());
  }

  static class CountingProcessor implements LoadRunProcessor {
    final AtomicInteger executions = new AtomicInteger();

    @Override
    public LoadRunReport execute(LoadRun run) {
      executions.incrementAndGet();
      return report("DURATION_ELAPSED");
    }

    @Override
    public void cancel(UUID runId) {}
  }

  /** Blocks until released or cancelled; reports a cancelled run when cancelled. */
  static class BlockingProcessor implements LoadRunProcessor {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicBoolean cancelRequested = new AtomicBoolean();
    final AtomicInteger executions = new AtomicInteger();

    @Override
    public LoadRunReport execute(LoadRun run) throws InterruptedException {
      executions.incrementAndGet();
      started.countDown();
      while (!release.await(20, TimeUnit.MILLISECONDS)) {
        if (cancelRequested.get()) {
          return report("CANCELLED");
        }
      }
      return report("DURATION_ELAPSED");
    }

    @Override
    public void cancel(UUID runId) {
      cancelRequested.set(true);
    }
  }
}
