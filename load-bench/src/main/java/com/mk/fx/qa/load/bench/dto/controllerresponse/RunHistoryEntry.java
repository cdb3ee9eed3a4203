package com.mk.fx.qa.load.bench.dto.controllerresponse;

import com.mk.fx.qa.load.bench.model.RunStatus;
import java.time.Instant;
import java.util.UUID;

public record RunHistoryEntry(
    UUID runId,
    String url,
    RunStatus status,
    Instant startedAt,
    Instant completedAt,
    long processingTimeMillis,
    String errorMessage) {}
