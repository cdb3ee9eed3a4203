package com.mk.fx.qa.load.bench.metrics;

/**
 * Recorded result of one request attempt.
 *
 * @param latencySeconds time from issuing the request to its completion or failure
 * @param result classification of the attempt
 * @param statusCode response status, {@code null} for transport errors
 * @param errorType transport failure category, {@code null} unless {@code result} is
 *     {@link OutcomeType#TRANSPORT_ERROR}
 */
public record Outcome(double latencySeconds, OutcomeType result, Integer statusCode, String errorType) {}
