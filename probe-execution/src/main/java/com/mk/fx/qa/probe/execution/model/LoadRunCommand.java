package com.mk.fx.qa.probe.execution.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A request to start a duration-bound load run.
 *
 * @param baseUrl base URL endpoints are resolved against
 * @param profile load shape, {@link LoadProfile#LOAD} when null
 * @param concurrency virtual users, profile default when null
 * @param duration run length, profile default when null or zero
 * @param ratePerSec per-user invocation rate, unthrottled when null
 * @param endpoints endpoints in {@code "METHOD /path"} notation
 * @param headers headers sent with every request
 * @param variables values substituted for {@code {{name}}} placeholders
 */
public record LoadRunCommand(
    String baseUrl,
    LoadProfile profile,
    Integer concurrency,
    Duration duration,
    Double ratePerSec,
    List<String> endpoints,
    Map<String, String> headers,
    Map<String, String> variables) {

  public LoadRunCommand {
    endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    variables = variables == null ? Map.of() : Map.copyOf(variables);
  }

  public RunConfig toRunConfig() {
    return new RunConfig(profile, concurrency == null ? 0 : concurrency, duration, ratePerSec);
  }
}
