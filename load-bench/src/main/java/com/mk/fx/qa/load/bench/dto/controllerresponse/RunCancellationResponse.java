package com.mk.fx.qa.load.bench.dto.controllerresponse;

import com.mk.fx.qa.load.bench.model.RunStatus;
import java.util.UUID;

public record RunCancellationResponse(UUID runId, RunStatus status, String message) {}
