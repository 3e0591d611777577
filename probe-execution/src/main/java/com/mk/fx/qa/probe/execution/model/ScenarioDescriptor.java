package com.mk.fx.qa.probe.execution.model;

import java.util.Map;
import java.util.Objects;

/**
 * One fully specified request plus the expectation it is verified against. Immutable once built;
 * each descriptor is consumed by exactly one invocation.
 *
 * @param id unique scenario identifier, e.g. {@code sec-001}
 * @param name human readable name
 * @param category grouping used for filtering (security, validation, happy_path, ...)
 * @param severity optional severity label carried through to the outcome report
 * @param method request method
 * @param target path relative to the run's base URL, or an absolute URL
 * @param headers request headers
 * @param body request body, a string or any JSON-serialisable value
 * @param expectation what the response must satisfy
 */
public record ScenarioDescriptor(
    String id,
    String name,
    String category,
    String severity,
    String method,
    String target,
    Map<String, String> headers,
    Object body,
    Expectation expectation) {

  public ScenarioDescriptor {
    Objects.requireNonNull(id, "id");
    method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase();
    target = target == null ? "" : target;
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    expectation = expectation == null ? Expectation.none() : expectation;
  }

  /** Builds an unnamed descriptor with no category, used by tests and load targets. */
  public static ScenarioDescriptor of(
      String id, String method, String target, Expectation expectation) {
    return new ScenarioDescriptor(id, id, null, null, method, target, null, null, expectation);
  }

  public String displayName() {
    return name == null || name.isBlank() ? id : name;
  }
}
