package com.mk.fx.qa.probe.execution.probe;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Response observed by a {@link Probe}. Header lookup is case-insensitive.
 *
 * @param statusCode response status
 * @param body response body, never null
 * @param headers response headers
 * @param latency round-trip time measured by the probe
 */
public record ProbeResponse(
    int statusCode, String body, Map<String, String> headers, Duration latency) {

  public ProbeResponse {
    body = body == null ? "" : body;
    var copy = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
    if (headers != null) {
      copy.putAll(headers);
    }
    headers = Collections.unmodifiableMap(copy);
    latency = latency == null || latency.isNegative() ? Duration.ZERO : latency;
  }

  public static ProbeResponse of(int statusCode) {
    return new ProbeResponse(statusCode, "", Map.of(), Duration.ZERO);
  }
}
