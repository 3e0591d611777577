package com.mk.fx.qa.probe.execution.rest;

import java.util.Arrays;

/** HTTP verbs a probe request may use. */
public enum HttpMethod {
  GET,
  POST,
  PUT,
  PATCH,
  DELETE,
  HEAD,
  OPTIONS;

  /**
   * Resolves a method name case-insensitively.
   *
   * @throws IllegalArgumentException if the name is blank or not a supported verb
   */
  public static HttpMethod fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Request method is required");
    }
    return Arrays.stream(values())
        .filter(method -> method.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported HTTP method: " + value));
  }
}
