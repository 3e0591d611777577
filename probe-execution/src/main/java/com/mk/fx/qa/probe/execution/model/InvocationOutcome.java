package com.mk.fx.qa.probe.execution.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.Instant;

/**
 * Result of exactly one probe invocation.
 *
 * @param scenarioId id of the descriptor that was invoked
 * @param scenarioName name of the descriptor
 * @param category category of the descriptor, may be null
 * @param success whether the invocation passed
 * @param actualStatus status observed, 0 when the probe failed before a response
 * @param expectedStatus exact status expected, 0 when not checked
 * @param latency observed latency
 * @param error failure description, null on success
 * @param responseBody response body snapshot, may be null
 * @param timestamp when the invocation started
 */
public record InvocationOutcome(
    String scenarioId,
    String scenarioName,
    String category,
    boolean success,
    int actualStatus,
    int expectedStatus,
    Duration latency,
    String error,
    String responseBody,
    Instant timestamp) {

  public InvocationOutcome {
    latency = latency == null || latency.isNegative() ? Duration.ZERO : latency;
  }

  /** Copy without the response body snapshot, for runs that retain many outcomes. */
  public InvocationOutcome withoutBody() {
    if (responseBody == null) {
      return this;
    }
    return new InvocationOutcome(
        scenarioId,
        scenarioName,
        category,
        success,
        actualStatus,
        expectedStatus,
        latency,
        error,
        null,
        timestamp);
  }

  @JsonProperty("durationMs")
  public long durationMs() {
    return latency.toMillis();
  }
}
