package com.mk.fx.qa.probe.execution.model;

import java.util.Map;

/**
 * An endpoint hit repeatedly by virtual users during a load run.
 *
 * @param method request method
 * @param path request path
 * @param headers request headers
 * @param body request body
 */
public record TargetDescriptor(
    String method, String path, Map<String, String> headers, Object body) {

  public TargetDescriptor {
    method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase();
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("Target path must be provided");
    }
    path = path.trim();
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  /**
   * Parses endpoint notation {@code "GET /api/users"}. A bare path defaults to GET.
   *
   * @throws IllegalArgumentException if the value is blank
   */
  public static TargetDescriptor parse(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) {
      throw new IllegalArgumentException("Endpoint must not be blank");
    }
    var parts = endpoint.trim().split("\\s+", 2);
    if (parts.length == 1) {
      return new TargetDescriptor("GET", parts[0], null, null);
    }
    return new TargetDescriptor(parts[0], parts[1], null, null);
  }

  /** Key identifying this target in logs and outcomes, e.g. {@code GET /api/users}. */
  public String key() {
    return method + " " + path;
  }

  /** Converts to a descriptor with no expectation; load runs judge responses by status class. */
  public ScenarioDescriptor toScenario() {
    return new ScenarioDescriptor(key(), key(), null, null, method, path, headers, body, null);
  }
}
