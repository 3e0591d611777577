package com.mk.fx.qa.probe.execution.model;

import java.util.List;
import java.util.Map;

/**
 * What a scenario's response must satisfy to pass. Null or zero values disable a check.
 *
 * @param statusCode exact status expected, {@code null}/0 to skip
 * @param statusRange inclusive status range, {@code null} to skip
 * @param bodyContains substrings that must all appear in the body
 * @param bodyNotContains substrings that must not appear in the body
 * @param headerContains header name to substring that the header value must contain
 * @param maxDurationMs latency ceiling in milliseconds, {@code null}/0 to skip
 */
public record Expectation(
    Integer statusCode,
    StatusRange statusRange,
    List<String> bodyContains,
    List<String> bodyNotContains,
    Map<String, String> headerContains,
    Long maxDurationMs) {

  private static final Expectation NONE = new Expectation(null, null, null, null, null, null);

  public Expectation {
    bodyContains = bodyContains == null ? List.of() : List.copyOf(bodyContains);
    bodyNotContains = bodyNotContains == null ? List.of() : List.copyOf(bodyNotContains);
    headerContains = headerContains == null ? Map.of() : Map.copyOf(headerContains);
  }

  /** An expectation that accepts any response. */
  public static Expectation none() {
    return NONE;
  }

  public static Expectation status(int statusCode) {
    return new Expectation(statusCode, null, null, null, null, null);
  }

  public boolean checksStatus() {
    return statusCode != null && statusCode != 0;
  }

  public boolean checksDuration() {
    return maxDurationMs != null && maxDurationMs > 0;
  }
}
