package com.mk.fx.qa.load.bench.dto.controllerresponse;

import com.mk.fx.qa.load.bench.metrics.LoadSummary;
import lombok.Data;

/** Current metrics of an active run, or the final metrics of a finished one. */
@Data
public class RunLiveMetricsResponse {

  private String runId;
  private String url;
  private String method;
  private double qps;
  private int concurrency;
  private int durationSeconds;
  private long targetRequestCount;

  private long totalRequests;
  private long successfulRequests;
  private long errors;
  private double achievedRps;
  private double elapsedSeconds;
  private LoadSummary summary;
}
