package com.mk.fx.qa.load.bench.dto.controllerresponse;

/** Pending runs, runs currently executing and whether new runs are accepted. */
public record QueueStatusResponse(int queueSize, int activeRuns, boolean acceptingRuns) {}
