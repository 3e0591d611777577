package com.mk.fx.qa.probe.execution.model;

import java.util.List;
import java.util.Map;

/**
 * A request to verify a batch of scenarios against one base URL.
 *
 * @param baseUrl base URL scenario targets are resolved against
 * @param concurrency ceiling on simultaneous invocations, configured default when null
 * @param category only run scenarios of this category, all when blank
 * @param categories only run scenarios in one of these categories, all when empty
 * @param headers headers sent with every scenario
 * @param variables values substituted for {@code {{name}}} placeholders in targets
 * @param scenarios scenarios to run
 */
public record BatchRunCommand(
    String baseUrl,
    Integer concurrency,
    String category,
    List<String> categories,
    Map<String, String> headers,
    Map<String, String> variables,
    List<ScenarioDescriptor> scenarios) {

  public BatchRunCommand {
    categories = categories == null ? List.of() : List.copyOf(categories);
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    variables = variables == null ? Map.of() : Map.copyOf(variables);
    scenarios = scenarios == null ? List.of() : List.copyOf(scenarios);
  }
}
