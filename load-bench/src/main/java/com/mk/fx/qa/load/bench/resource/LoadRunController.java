package com.mk.fx.qa.load.bench.resource;

import static com.mk.fx.qa.load.bench.model.RunStatus.PROCESSING;

import com.mk.fx.qa.load.bench.dto.controllerresponse.HealthResponse;
import com.mk.fx.qa.load.bench.dto.controllerresponse.LoadRunRequest;
import com.mk.fx.qa.load.bench.dto.controllerresponse.QueueStatusResponse;
import com.mk.fx.qa.load.bench.dto.controllerresponse.RunCancellationResponse;
import com.mk.fx.qa.load.bench.dto.controllerresponse.RunHistoryEntry;
import com.mk.fx.qa.load.bench.dto.controllerresponse.RunServiceMetricsResponse;
import com.mk.fx.qa.load.bench.dto.controllerresponse.RunStatusResponse;
import com.mk.fx.qa.load.bench.dto.controllerresponse.RunSubmissionResponse;
import com.mk.fx.qa.load.bench.metrics.LoadMetricsRegistry;
import com.mk.fx.qa.load.bench.model.RunStatus;
import com.mk.fx.qa.load.bench.service.LoadRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Load Runs", description = "Submit, monitor and cancel rate-controlled load runs")
@RestController
@RequestMapping("/api/runs")
@Validated
@RequiredArgsConstructor
public class LoadRunController {

  private final LoadRunService loadRunService;
  private final LoadMetricsRegistry metricsRegistry;
  private final RunMapper runMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Submission
  // -----------------------------------------------------
  @Operation(summary = "Submit a load run", description = "Validates and queues a load run.")
  @PostMapping
  public ResponseEntity<RunSubmissionResponse> submitRun(
      @Valid @RequestBody LoadRunRequest request) {
    log.info(
        "Received run submission {} {} at {}/s",
        request.getMethod(),
        request.getUrl(),
        request.getQps());
    var run = runMapper.toDomain(request);
    var outcomeOpt = loadRunService.submitRun(run);

    if (outcomeOpt.isEmpty()) {
      return responseFactory.unavailable(
          new RunSubmissionResponse(null, RunStatus.CANCELLED, "Service not accepting new runs"));
    }

    var outcome = outcomeOpt.get();
    var status = outcome.status() == RunStatus.ERROR ? HttpStatus.CONFLICT : HttpStatus.ACCEPTED;
    return ResponseEntity.status(status)
        .body(new RunSubmissionResponse(outcome.runId(), outcome.status(), outcome.message()));
  }

  // -----------------------------------------------------
  // Status and control
  // -----------------------------------------------------
  @Operation(summary = "Get run status", description = "Returns the current status of a run.")
  @GetMapping("/{runId}")
  public ResponseEntity<RunStatusResponse> getRunStatus(@PathVariable UUID runId) {
    return loadRunService
        .getRunStatus(runId)
        .map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Run {} not found", runId);
              return ResponseEntity.notFound().build();
            });
  }

  @Operation(summary = "Cancel run", description = "Cancels a queued run or stops a running one.")
  @DeleteMapping("/{runId}")
  public ResponseEntity<?> cancelRun(@PathVariable UUID runId) {
    var result = loadRunService.cancelRun(runId);
    log.info("Cancellation requested for {} -> {}", runId, result.getState());
    return switch (result.getState()) {
      case NOT_FOUND -> responseFactory.notFound("Run not found");
      case NOT_CANCELLABLE -> responseFactory.error(
          HttpStatus.CONFLICT, "Conflict", "Run cannot be cancelled in its current state");
      case CANCELLED -> ResponseEntity.ok(
          new RunCancellationResponse(runId, RunStatus.CANCELLED, "Run cancelled"));
      case CANCELLATION_REQUESTED -> {
        var current =
            loadRunService.getRunStatus(runId).map(RunStatusResponse::status).orElse(PROCESSING);
        yield ResponseEntity.ok(
            new RunCancellationResponse(runId, current, "Cancellation requested"));
      }
    };
  }

  // -----------------------------------------------------
  // Listings and history
  // -----------------------------------------------------
  @Operation(summary = "List runs", description = "Lists all runs or filters them by status.")
  @GetMapping
  public ResponseEntity<?> getRuns(@RequestParam(required = false) String status) {
    if (status == null) {
      return ResponseEntity.ok(loadRunService.getAllRuns());
    }
    RunStatus runStatus;
    try {
      runStatus = RunStatus.fromValue(status);
    } catch (IllegalArgumentException ex) {
      log.warn("Invalid status filter: {}", status);
      return responseFactory.error(
          HttpStatus.BAD_REQUEST,
          "Invalid Status",
          "Unrecognized status: " + status + ". Allowed: " + Arrays.toString(RunStatus.values()));
    }
    return ResponseEntity.ok(loadRunService.getRunsByStatus(runStatus));
  }

  @Operation(summary = "Run history", description = "Returns the most recently finished runs.")
  @GetMapping("/history")
  public ResponseEntity<List<RunHistoryEntry>> getRunHistory() {
    return ResponseEntity.ok(loadRunService.getRunHistory());
  }

  // -----------------------------------------------------
  // Queue and metrics
  // -----------------------------------------------------
  @Operation(summary = "Queue status", description = "Returns pending and active run counts.")
  @GetMapping("/queue")
  public ResponseEntity<QueueStatusResponse> getQueueStatus() {
    return ResponseEntity.ok(loadRunService.getQueueStatus());
  }

  @Operation(summary = "Service metrics", description = "Returns aggregate metrics across runs.")
  @GetMapping("/metrics")
  public ResponseEntity<RunServiceMetricsResponse> getMetrics() {
    return ResponseEntity.ok(loadRunService.getMetrics());
  }

  @Operation(
      summary = "Run metrics",
      description = "Returns the live snapshot of an active run or the final one.")
  @GetMapping("/{runId}/metrics")
  public ResponseEntity<?> getRunMetrics(@PathVariable UUID runId) {
    return metricsRegistry
        .getSnapshot(runId)
        .<ResponseEntity<?>>map(snapshot -> ResponseEntity.ok(runMapper.toLiveMetrics(snapshot)))
        .orElseGet(
            () -> {
              log.warn("Metrics not found for run {}", runId);
              return responseFactory.notFound("Metrics not found for run: " + runId);
            });
  }

  @Operation(summary = "Run report", description = "Returns the final report of a finished run.")
  @GetMapping("/{runId}/report")
  public ResponseEntity<?> getRunReport(@PathVariable UUID runId) {
    return metricsRegistry
        .getReport(runId)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Report not found for run {}", runId);
              return responseFactory.notFound("Report not found for run: " + runId);
            });
  }

  @Operation(summary = "Health check", description = "Verifies service health.")
  @GetMapping("/healthy")
  public ResponseEntity<HealthResponse> health() {
    boolean healthy = loadRunService.isHealthy();
    log.debug("Health check: {}", healthy ? "UP" : "DOWN");
    return ResponseEntity.ok(new HealthResponse(healthy ? "UP" : "DOWN"));
  }
}
