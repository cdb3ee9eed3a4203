package com.mk.fx.qa.load.bench.dto.controllerresponse;

import com.mk.fx.qa.load.bench.model.RunStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * Status of a run: target, lifecycle timestamps, processing time and error message if any.
 */
public record RunStatusResponse(
    UUID runId,
    String url,
    String method,
    RunStatus status,
    Instant submittedAt,
    Instant startedAt,
    Instant completedAt,
    Long processingTimeMillis,
    String errorMessage) {}
