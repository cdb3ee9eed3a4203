package com.mk.fx.qa.load.bench.processors.http;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.bench.dto.report.LoadRunReport;
import com.mk.fx.qa.load.bench.metrics.LoadMetricsRegistry;
import com.mk.fx.qa.load.bench.model.InvalidConfigurationException;
import com.mk.fx.qa.load.bench.model.LoadRun;
import com.mk.fx.qa.load.bench.model.LoadRunDefinition;
import com.mk.fx.qa.load.bench.rest.HttpMethod;
import com.sun.net.httpserver.HttpServer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpLoadRunProcessorTest {

  private HttpServer server;
  private ExecutorService serverPool;
  private String baseUrl;
  private final AtomicInteger hits = new AtomicInteger();
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private final AtomicReference<String> lastAuth = new AtomicReference<>();

  private LoadMetricsRegistry registry;
  private HttpLoadRunProcessor processor;

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext(
        "/ok",
        exchange -> {
          hits.incrementAndGet();
          lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
          exchange.sendResponseHeaders(200, -1);
          exchange.close();
        });
    server.createContext(
        "/created",
        exchange -> {
          exchange.getRequestBody().readAllBytes();
          exchange.sendResponseHeaders(201, -1);
          exchange.close();
        });
    serverPool = Executors.newCachedThreadPool();
    server.setExecutor(serverPool);
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

    registry = new LoadMetricsRegistry();
    processor = new HttpLoadRunProcessor(registry);
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
    if (serverPool != null) serverPool.shutdownNow();
  }

  private static LoadRun run(
      String url, HttpMethod method, double qps, int duration, int concurrency, int expected) {
    return LoadRun.of(
        new LoadRunDefinition(
            url, method, qps, duration, concurrency, 1, Map.of(), null, expected, "token-1"));
  }

  @Test
  void execute_successfulTarget_recordsSuccesses() throws Exception {
    var run = run(baseUrl + "/ok", HttpMethod.POST, 10, 2, 2, 200);

    var report = processor.execute(run);

    assertTrue(report.summary.totalRequests() >= 10, "total " + report.summary.totalRequests());
    assertTrue(report.summary.totalRequests() <= 22, "total " + report.summary.totalRequests());
    assertEquals(report.summary.totalRequests(), report.summary.successfulRequests());
    assertEquals(1.0, report.summary.successRate());
    assertEquals(hits.get(), report.summary.totalRequests());
    assertEquals(LoadRunDefinition.DEFAULT_PAYLOAD, lastBody.get());
    assertEquals("Bearer token-1", lastAuth.get());
    assertEquals("DURATION_ELAPSED", report.completion.reason);
    assertSame(report, registry.getReport(run.getId()).orElseThrow());
    assertEquals(
        report.summary.totalRequests(),
        registry.getSnapshot(run.getId()).orElseThrow().totalRequests());
  }

  @Test
  void execute_unexpectedStatus_countsMismatches() throws Exception {
    var report = processor.execute(run(baseUrl + "/created", HttpMethod.GET, 5, 1, 1, 200));

    assertTrue(report.summary.totalRequests() > 0);
    assertEquals(0, report.summary.successfulRequests());
    assertEquals(1.0, report.summary.errorRate());
    assertEquals(report.summary.totalRequests(), report.details.statusMismatches);
    assertEquals(report.summary.totalRequests(), report.details.statusBreakdown.get(201));
  }

  @Test
  void execute_unreachableTarget_recordsTransportErrors() throws Exception {
    var report = processor.execute(run("http://127.0.0.1:1/", HttpMethod.GET, 5, 1, 1, 200));

    assertTrue(report.summary.totalRequests() > 0);
    assertEquals(0, report.summary.successfulRequests());
    assertEquals(report.summary.totalRequests(), report.details.transportErrors);
    assertFalse(report.details.errorBreakdown.isEmpty());
    assertFalse(report.details.errorSamples.isEmpty());
  }

  @Test
  void execute_invalidUrl_failsBeforeAnyRequest() {
    var run = run("ftp://127.0.0.1/file", HttpMethod.GET, 5, 1, 1, 200);

    assertThrows(InvalidConfigurationException.class, () -> processor.execute(run));
    assertTrue(registry.getReport(run.getId()).isEmpty());
  }

  @Test
  void cancel_stopsActiveRun() throws Exception {
    var run = run(baseUrl + "/ok", HttpMethod.GET, 20, 30, 2, 200);
    ExecutorService caller = Executors.newSingleThreadExecutor();
    try {
      Future<LoadRunReport> future =
          caller.submit(() -> processor.execute(run));

      await().atMost(Duration.ofSeconds(5)).until(() -> hits.get() > 0);
      processor.cancel(run.getId());
      var report = future.get(10, TimeUnit.SECONDS);

      assertEquals("CANCELLED", report.completion.reason);
      assertTrue(report.durationSec < 30);
    } finally {
      caller.shutdownNow();
    }
  }

  @Test
  void cancel_unknownRun_isIgnored() {
    assertDoesNotThrow(() -> processor.cancel(UUID.randomUUID()));
  }
}
