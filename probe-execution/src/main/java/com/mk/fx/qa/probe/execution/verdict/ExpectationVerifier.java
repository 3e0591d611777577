package com.mk.fx.qa.probe.execution.verdict;

import com.mk.fx.qa.probe.execution.model.Expectation;
import com.mk.fx.qa.probe.execution.probe.ProbeResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Compares a probe response with a scenario's {@link Expectation}.
 *
 * <p>Checks run in a fixed order: exact status, status range, required substrings, forbidden
 * substrings, headers by name, latency ceiling. Every mismatch is reported and the same response
 * always yields the same message.
 */
public final class ExpectationVerifier {

  private ExpectationVerifier() {
    throw new UnsupportedOperationException("ExpectationVerifier cannot be instantiated");
  }

  /**
   * Verifies a response.
   *
   * @param expectation what the response must satisfy
   * @param response the observed response
   * @param latency latency to hold against the duration ceiling
   * @return the verdict, never null
   */
  public static Verdict verify(Expectation expectation, ProbeResponse response, Duration latency) {
    if (expectation == null) {
      return Verdict.passed();
    }
    List<String> failures = new ArrayList<>();
    int status = response.statusCode();

    if (expectation.checksStatus() && expectation.statusCode() != status) {
      failures.add(
          String.format(
              "Status code mismatch: expected %d, got %d", expectation.statusCode(), status));
    }

    var range = expectation.statusRange();
    if (range != null && !range.contains(status)) {
      failures.add(
          String.format("Status code %d out of range [%d-%d]", status, range.min(), range.max()));
    }

    var body = response.body();
    for (String required : expectation.bodyContains()) {
      if (!body.contains(required)) {
        failures.add(String.format("Body missing expected string: '%s'", required));
      }
    }
    for (String forbidden : expectation.bodyNotContains()) {
      if (body.contains(forbidden)) {
        failures.add(String.format("Body contains forbidden string: '%s'", forbidden));
      }
    }

    var headerChecks = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
    headerChecks.putAll(expectation.headerContains());
    headerChecks.forEach(
        (name, expected) -> {
          var actual = response.headers().get(name);
          if (actual == null) {
            failures.add(String.format("Header '%s' not found", name));
          } else if (!actual.contains(expected)) {
            failures.add(
                String.format("Header '%s': expected '%s', got '%s'", name, expected, actual));
          }
        });

    if (expectation.checksDuration()) {
      long elapsedMs = latency.toMillis();
      if (elapsedMs > expectation.maxDurationMs()) {
        failures.add(
            String.format(
                "Response time %dms exceeded max %dms", elapsedMs, expectation.maxDurationMs()));
      }
    }

    return failures.isEmpty() ? Verdict.passed() : new Verdict(failures);
  }
}
