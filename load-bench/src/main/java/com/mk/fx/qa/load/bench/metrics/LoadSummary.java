package com.mk.fx.qa.load.bench.metrics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Final summary of a run. The JSON field names are the report format consumed by existing
 * tooling and must not change.
 *
 * <p>Latencies are in seconds; rates are fractions between 0 and 1.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({
  "total_requests",
  "successful_requests",
  "average_latency",
  "error_rate",
  "success_rate",
  "50th_percentile",
  "90th_percentile",
  "95th_percentile",
  "99th_percentile"
})
public record LoadSummary(
    @JsonProperty("total_requests") long totalRequests,
    @JsonProperty("successful_requests") long successfulRequests,
    @JsonProperty("average_latency") double averageLatency,
    @JsonProperty("error_rate") double errorRate,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("50th_percentile") double p50,
    @JsonProperty("90th_percentile") double p90,
    @JsonProperty("95th_percentile") double p95,
    @JsonProperty("99th_percentile") double p99) {

  public static LoadSummary empty() {
    return new LoadSummary(0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
  }
}
