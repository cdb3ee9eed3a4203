package com.mk.fx.qa.load.bench.service;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.load.bench.cfg.RunProcessingCfg;
import com.mk.fx.qa.load.bench.dto.controllerresponse.QueueStatusResponse;
import com.mk.fx.qa.load.bench.dto.controllerresponse.RunHistoryEntry;
import com.mk.fx.qa.load.bench.dto.controllerresponse.RunServiceMetricsResponse;
import com.mk.fx.qa.load.bench.dto.controllerresponse.RunStatusResponse;
import com.mk.fx.qa.load.bench.dto.controllerresponse.RunSubmissionOutcome;
import com.mk.fx.qa.load.bench.dto.report.LoadRunReport;
import com.mk.fx.qa.load.bench.model.LoadRun;
import com.mk.fx.qa.load.bench.model.RunRecord;
import com.mk.fx.qa.load.bench.model.RunStatus;
import com.mk.fx.qa.load.bench.processors.LoadRunProcessor;
import com.mk.fx.qa.load.bench.processors.LoadRunValidator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Submits, executes, tracks and cancels load runs.
 *
 * <p>Runs are validated on submission, then queued on a fixed pool of {@code load.runs.concurrency}
 * threads. Each run moves through {@code QUEUED → PROCESSING → COMPLETED | ERROR | CANCELLED}. A
 * run whose report says it was cancelled ends as {@code CANCELLED}; an unexpected exception ends
 * it as {@code ERROR} and the service keeps accepting runs.
 *
 * <p>Thread-safety: state lives in concurrent maps, atomics and synchronized {@link RunRecord}
 * transitions. Read methods return snapshots.
 */
@Slf4j
@Service
public class LoadRunService {

  private final RunProcessingCfg properties;
  private final LoadRunProcessor processor;
  private final ThreadPoolExecutor executor;
  private final Map<UUID, RunRecord> runRecords = new ConcurrentHashMap<>();
  private final Map<UUID, Future<?>> activeRuns = new ConcurrentHashMap<>();
  private final Deque<RunRecord> runHistory = new ConcurrentLinkedDeque<>();
  private final AtomicBoolean acceptingRuns = new AtomicBoolean(true);
  private final AtomicInteger activeRunCount = new AtomicInteger();
  private final AtomicLong totalCompleted = new AtomicLong();
  private final AtomicLong totalFailed = new AtomicLong();
  private final AtomicLong totalCancelled = new AtomicLong();
  private final AtomicLong cumulativeProcessingTime = new AtomicLong();

  public LoadRunService(RunProcessingCfg properties, LoadRunProcessor processor) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.processor = Objects.requireNonNull(processor, "processor");
    this.executor = createExecutor(properties.getConcurrency());
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "LoadRunService initialised with concurrency={} historySize={}",
        properties.getConcurrency(),
        properties.getHistorySize());
  }

  private ThreadPoolExecutor createExecutor(int concurrency) {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("load-run-worker-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    ThreadPoolExecutor pool = (ThreadPoolExecutor) newFixedThreadPool(concurrency, threadFactory);
    pool.setRejectedExecutionHandler(
        (runnable, exec) -> {
          throw new RejectedExecutionException("Run queue is full");
        });
    return pool;
  }

  /**
   * Validates and queues a run.
   *
   * @return empty if the service no longer accepts runs, otherwise the submission outcome
   * @throws com.mk.fx.qa.load.bench.model.InvalidConfigurationException if the run cannot be
   *     executed as defined
   */
  public Optional<RunSubmissionOutcome> submitRun(LoadRun run) {
    Objects.requireNonNull(run, "run");
    if (!acceptingRuns.get()) {
      return Optional.empty();
    }
    LoadRunValidator.validate(run.getDefinition());

    var record = new RunRecord(run, Instant.now());
    if (runRecords.putIfAbsent(run.getId(), record) != null) {
      return Optional.of(
          new RunSubmissionOutcome(run.getId(), RunStatus.ERROR, "Run ID already exists"));
    }

    try {
      Future<?> future = executor.submit(() -> executeRun(record));
      activeRuns.put(run.getId(), future);
      if (future.isDone()) {
        activeRuns.remove(run.getId());
      }
      log.info(
          "Run {} submitted ({} {} at {}/s)",
          run.getId(),
          run.getDefinition().method(),
          run.getDefinition().url(),
          run.getDefinition().qps());
      var statusSnapshot = record.getStatus();
      var message =
          switch (statusSnapshot) {
            case QUEUED -> "Run queued";
            case PROCESSING -> "Run is processing";
            case COMPLETED -> "Run completed";
            case ERROR -> "Run failed";
            case CANCELLED -> "Run cancelled";
          };
      return Optional.of(new RunSubmissionOutcome(run.getId(), statusSnapshot, message));
    } catch (RejectedExecutionException ex) {
      log.warn("Run {} rejected: {}", run.getId(), ex.getMessage());
      runRecords.remove(run.getId());
      return Optional.of(new RunSubmissionOutcome(run.getId(), RunStatus.ERROR, ex.getMessage()));
    }
  }

  private void executeRun(RunRecord record) {
    var runId = record.getRunId();
    var started = false;
    try {
      if (Thread.currentThread().isInterrupted() || !record.markProcessing(Instant.now())) {
        if (record.markCancelled(Instant.now())) {
          totalCancelled.incrementAndGet();
          log.info("Run {} cancelled before start", runId);
        }
        return;
      }
      started = true;
      activeRunCount.incrementAndGet();
      log.info("Run {} started", runId);

      LoadRunReport report = processor.execute(record.getRun());

      if (report != null
          && report.completion != null
          && "CANCELLED".equals(report.completion.reason)) {
        markCancelled(record);
      } else if (record.markCompleted(Instant.now())) {
        totalCompleted.incrementAndGet();
        cumulativeProcessingTime.addAndGet(record.getProcessingDurationMillis());
        log.info("Run {} completed", runId);
      }
    } catch (InterruptedException interruptedException) {
      Thread.currentThread().interrupt();
      markCancelled(record);
    } catch (Exception ex) {
      if (record.markErrored(Instant.now(), ex.getMessage())) {
        totalFailed.incrementAndGet();
      }
      log.error("Run {} failed: {}", runId, ex.getMessage(), ex);
    } finally {
      if (started) {
        activeRunCount.decrementAndGet();
      }
      activeRuns.remove(runId);
      if (started) {
        addToHistory(record);
      }
    }
  }

  private void markCancelled(RunRecord record) {
    if (record.markCancelled(Instant.now())) {
      totalCancelled.incrementAndGet();
      log.info("Run {} cancelled", record.getRunId());
    }
  }

  private void addToHistory(RunRecord record) {
    if (runHistory.contains(record)) {
      return;
    }
    runHistory.addFirst(record);
    while (runHistory.size() > properties.getHistorySize()) {
      runHistory.pollLast();
    }
  }

  public Optional<RunStatusResponse> getRunStatus(UUID runId) {
    return Optional.ofNullable(runRecords.get(runId)).map(this::toStatusResponse);
  }

  /** All known runs, most recently submitted first. */
  public List<RunStatusResponse> getAllRuns() {
    return runRecords.values().stream()
        .sorted(Comparator.comparing(RunRecord::getSubmittedAt).reversed())
        .map(this::toStatusResponse)
        .toList();
  }

  public List<RunStatusResponse> getRunsByStatus(RunStatus status) {
    return getAllRuns().stream().filter(run -> run.status() == status).toList();
  }

  /** Most recently finished runs, bounded by the configured history size. */
  public List<RunHistoryEntry> getRunHistory() {
    List<RunHistoryEntry> snapshot = new ArrayList<>();
    for (RunRecord record : runHistory) {
      snapshot.add(
          new RunHistoryEntry(
              record.getRunId(),
              record.getRun().getDefinition().url(),
              record.getStatus(),
              record.getStartedAt().orElse(null),
              record.getCompletedAt().orElse(null),
              record.getProcessingDurationMillis(),
              record.getErrorMessage().orElse(null)));
    }
    return snapshot;
  }

  public QueueStatusResponse getQueueStatus() {
    return new QueueStatusResponse(
        executor.getQueue().size(), activeRunCount.get(), acceptingRuns.get());
  }

  public RunServiceMetricsResponse getMetrics() {
    var completed = totalCompleted.get();
    var failed = totalFailed.get();
    var cancelled = totalCancelled.get();
    var processedForSuccessRate = completed + failed;
    var avgProcessing = completed == 0 ? 0.0 : (double) cumulativeProcessingTime.get() / completed;
    var successRate =
        processedForSuccessRate == 0 ? 0.0 : (double) completed / processedForSuccessRate;
    return new RunServiceMetricsResponse(
        completed, failed, cancelled, avgProcessing, successRate, processedForSuccessRate);
  }

  /**
   * Cancels a run.
   *
   * <p>A queued run is cancelled immediately. A running run is asked to stop: the processor stops
   * its workers, drains in-flight requests and the run ends as {@code CANCELLED} with a report.
   * Unknown runs and runs in a terminal state are reported as such.
   */
  public CancellationResult cancelRun(UUID runId) {
    var record = runRecords.get(runId);
    if (record == null) {
      return CancellationResult.notFound();
    }
    var status = record.getStatus();
    if (status.isTerminal()) {
      return CancellationResult.notCancellable(status);
    }

    if (status == RunStatus.QUEUED && record.markCancelled(Instant.now())) {
      totalCancelled.incrementAndGet();
      var future = activeRuns.remove(runId);
      if (future != null) {
        future.cancel(false);
      }
      addToHistory(record);
      log.info("Run {} cancelled while queued", runId);
      return CancellationResult.cancelled(RunStatus.CANCELLED);
    }

    processor.cancel(runId);
    var future = activeRuns.get(runId);
    if (future != null) {
      future.cancel(true);
    }
    log.info("Run {} cancellation requested", runId);
    return CancellationResult.cancellationRequested(record.getStatus());
  }

  /** Stops accepting runs and shuts the pool down; running runs continue. */
  public void shutdown() {
    if (acceptingRuns.compareAndSet(true, false)) {
      executor.shutdown();
    }
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  public boolean isHealthy() {
    return acceptingRuns.get() && !executor.isShutdown();
  }

  private RunStatusResponse toStatusResponse(RunRecord record) {
    var definition = record.getRun().getDefinition();
    return new RunStatusResponse(
        record.getRunId(),
        definition.url(),
        definition.method().name(),
        record.getStatus(),
        record.getSubmittedAt(),
        record.getStartedAt().orElse(null),
        record.getCompletedAt().orElse(null),
        record.getProcessingDurationMillis(),
        record.getErrorMessage().orElse(null));
  }

  /** Outcome of a cancellation attempt. */
  @Getter
  public static class CancellationResult {
    public enum CancellationState {
      CANCELLED,
      CANCELLATION_REQUESTED,
      NOT_FOUND,
      NOT_CANCELLABLE
    }

    private final CancellationState state;
    private final RunStatus runStatus;

    private CancellationResult(CancellationState state, RunStatus runStatus) {
      this.state = state;
      this.runStatus = runStatus;
    }

    public static CancellationResult cancelled(RunStatus status) {
      return new CancellationResult(CancellationState.CANCELLED, status);
    }

    public static CancellationResult cancellationRequested(RunStatus status) {
      return new CancellationResult(CancellationState.CANCELLATION_REQUESTED, status);
    }

    public static CancellationResult notFound() {
      return new CancellationResult(CancellationState.NOT_FOUND, null);
    }

    public static CancellationResult notCancellable(RunStatus status) {
      return new CancellationResult(CancellationState.NOT_CANCELLABLE, status);
    }
  }
}
