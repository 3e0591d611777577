package com.mk.fx.qa.probe.execution.model;

/**
 * Summary of a set of invocation outcomes. Latencies are in milliseconds.
 *
 * <p>{@code success + fail == total} and {@code p50Ms <= p95Ms <= p99Ms} always hold.
 */
public record ExecutionMetrics(
    long total,
    long success,
    long fail,
    double successRate,
    double avgLatencyMs,
    double minLatencyMs,
    double maxLatencyMs,
    double p50Ms,
    double p95Ms,
    double p99Ms,
    double requestsPerSecond) {

  private static final ExecutionMetrics EMPTY =
      new ExecutionMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

  public static ExecutionMetrics empty() {
    return EMPTY;
  }
}
