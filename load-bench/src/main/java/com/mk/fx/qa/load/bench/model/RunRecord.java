package com.mk.fx.qa.load.bench.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Mutable lifecycle record of a run inside the service. Transitions are synchronized; once a
 * terminal status is reached further transitions are ignored.
 */
public class RunRecord {

  private final LoadRun run;
  private final Instant submittedAt;

  private RunStatus status = RunStatus.QUEUED;
  private Instant startedAt;
  private Instant completedAt;
  private String errorMessage;

  public RunRecord(LoadRun run, Instant submittedAt) {
    this.run = Objects.requireNonNull(run, "run");
    this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt");
  }

  public UUID getRunId() {
    return run.getId();
  }

  public LoadRun getRun() {
    return run;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public synchronized RunStatus getStatus() {
    return status;
  }

  public synchronized Optional<Instant> getStartedAt() {
    return Optional.ofNullable(startedAt);
  }

  public synchronized Optional<Instant> getCompletedAt() {
    return Optional.ofNullable(completedAt);
  }

  public synchronized Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  /** Milliseconds between start and completion, or until now while processing; 0 if never started. */
  public synchronized long getProcessingDurationMillis() {
    if (startedAt == null) {
      return 0L;
    }
    var end = completedAt != null ? completedAt : Instant.now();
    return Math.max(0L, Duration.between(startedAt, end).toMillis());
  }

  public synchronized boolean markProcessing(Instant at) {
    if (status != RunStatus.QUEUED) {
      return false;
    }
    status = RunStatus.PROCESSING;
    startedAt = at;
    return true;
  }

  public synchronized boolean markCompleted(Instant at) {
    return finish(RunStatus.COMPLETED, at, null);
  }

  public synchronized boolean markErrored(Instant at, String message) {
    return finish(RunStatus.ERROR, at, message);
  }

  public synchronized boolean markCancelled(Instant at) {
    return finish(RunStatus.CANCELLED, at, null);
  }

  private boolean finish(RunStatus terminal, Instant at, String message) {
    if (status.isTerminal()) {
      return false;
    }
    status = terminal;
    completedAt = at;
    errorMessage = message;
    return true;
  }
}
