package com.mk.fx.qa.load.bench.processors;

import com.mk.fx.qa.load.bench.dto.report.LoadRunReport;
import com.mk.fx.qa.load.bench.model.LoadRun;
import java.util.UUID;

public interface LoadRunProcessor {

  /**
   * Executes the run to completion and returns its final report. A run cancelled while active
   * still returns a report, with completion reason {@code CANCELLED}.
   *
   * @throws InterruptedException if the calling thread was interrupted before the run started
   */
  LoadRunReport execute(LoadRun run) throws InterruptedException;

  void cancel(UUID runId);
}
