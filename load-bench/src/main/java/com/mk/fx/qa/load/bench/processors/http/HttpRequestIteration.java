package com.mk.fx.qa.load.bench.processors.http;

import com.mk.fx.qa.load.bench.executors.paced.PacedIteration;
import com.mk.fx.qa.load.bench.metrics.OutcomeRecorder;
import com.mk.fx.qa.load.bench.rest.LoadHttpClient;
import com.mk.fx.qa.load.bench.rest.Request;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues one request and records its outcome. Latency spans from just before the request is sent
 * to its completion or failure. Failures are recorded as transport errors and never retried.
 */
@Slf4j
class HttpRequestIteration implements PacedIteration {

  private final LoadHttpClient client;
  private final Request request;
  private final int expectedStatus;
  private final OutcomeRecorder recorder;

  HttpRequestIteration(
      LoadHttpClient client, Request request, int expectedStatus, OutcomeRecorder recorder) {
    this.client = Objects.requireNonNull(client, "client");
    this.request = Objects.requireNonNull(request, "request");
    this.expectedStatus = expectedStatus;
    this.recorder = Objects.requireNonNull(recorder, "recorder");
  }

  @Override
  public void run(int workerIndex) throws InterruptedException {
    long start = System.nanoTime();
    try {
      var response = client.execute(request);
      var outcome = recorder.record(secondsSince(start), response.getStatusCode(), expectedStatus);
      log.debug(
          "Worker {} {} -> {} in {}s",
          workerIndex + 1,
          request.getMethod(),
          response.getStatusCode(),
          outcome.latencySeconds());
    } catch (RuntimeException ex) {
      var outcome = recorder.recordTransportError(secondsSince(start), ex);
      log.debug(
          "Worker {} {} failed ({}) after {}s: {}",
          workerIndex + 1,
          request.getMethod(),
          outcome.errorType(),
          outcome.latencySeconds(),
          ex.getMessage());
    }
  }

  private static double secondsSince(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000_000.0;
  }
}
