package com.mk.fx.qa.load.bench.dto.controllerresponse;

import com.mk.fx.qa.load.bench.model.RunStatus;
import java.util.UUID;

/** Outcome of a submission as seen by the service: run id, status snapshot and message. */
public record RunSubmissionOutcome(UUID runId, RunStatus status, String message) {}
