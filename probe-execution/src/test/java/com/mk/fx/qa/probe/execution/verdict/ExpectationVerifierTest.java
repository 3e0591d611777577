package com.mk.fx.qa.probe.execution.verdict;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.probe.execution.model.Expectation;
import com.mk.fx.qa.probe.execution.model.StatusRange;
import com.mk.fx.qa.probe.execution.probe.ProbeResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExpectationVerifierTest {

  private static ProbeResponse response(int status, String body, Map<String, String> headers) {
    return new ProbeResponse(status, body, headers, Duration.ofMillis(20));
  }

  @Test
  void emptyExpectation_acceptsAnything() {
    var verdict =
        ExpectationVerifier.verify(
            Expectation.none(), response(500, "boom", Map.of()), Duration.ofSeconds(9));

    assertTrue(verdict.isPassed());
    assertNull(verdict.message());
  }

  @Test
  void exactStatusMismatch_isReported() {
    var verdict =
        ExpectationVerifier.verify(
            Expectation.status(201), response(200, "", Map.of()), Duration.ZERO);

    assertFalse(verdict.isPassed());
    assertEquals("Status code mismatch: expected 201, got 200", verdict.message());
  }

  @Test
  void zeroStatusCode_skipsStatusCheck() {
    var expectation = new Expectation(0, null, null, null, null, null);

    assertTrue(
        ExpectationVerifier.verify(expectation, response(418, "", Map.of()), Duration.ZERO)
            .isPassed());
  }

  @Test
  void statusRange_isInclusive() {
    var expectation = new Expectation(null, new StatusRange(400, 499), null, null, null, null);

    assertTrue(
        ExpectationVerifier.verify(expectation, response(400, "", Map.of()), Duration.ZERO)
            .isPassed());
    assertTrue(
        ExpectationVerifier.verify(expectation, response(499, "", Map.of()), Duration.ZERO)
            .isPassed());
    assertEquals(
        "Status code 500 out of range [400-499]",
        ExpectationVerifier.verify(expectation, response(500, "", Map.of()), Duration.ZERO)
            .message());
  }

  @Test
  void bodyChecks_reportMissingAndForbiddenStrings() {
    var expectation =
        new Expectation(
            null, null, List.of("token", "expires"), List.of("password"), null, null);

    var verdict =
        ExpectationVerifier.verify(
            expectation, response(200, "{\"token\":\"x\",\"password\":\"y\"}", Map.of()), null);

    assertEquals(
        List.of(
            "Body missing expected string: 'expires'",
            "Body contains forbidden string: 'password'"),
        verdict.failures());
  }

  @Test
  void headerChecks_matchNamesCaseInsensitively() {
    var expectation =
        new Expectation(
            null,
            null,
            null,
            null,
            Map.of("content-type", "json", "X-Frame-Options", "DENY", "X-Trace", "abc"),
            null);
    var headers =
        Map.of("Content-Type", "application/json", "x-frame-options", "SAMEORIGIN");

    var verdict =
        ExpectationVerifier.verify(expectation, response(200, "", headers), Duration.ZERO);

    assertEquals(
        List.of(
            "Header 'X-Frame-Options': expected 'DENY', got 'SAMEORIGIN'",
            "Header 'X-Trace' not found"),
        verdict.failures());
  }

  @Test
  void maxDuration_comparesObservedLatency() {
    var expectation = new Expectation(null, null, null, null, null, 100L);

    assertTrue(
        ExpectationVerifier.verify(expectation, response(200, "", Map.of()), Duration.ofMillis(100))
            .isPassed());
    assertEquals(
        "Response time 150ms exceeded max 100ms",
        ExpectationVerifier.verify(expectation, response(200, "", Map.of()), Duration.ofMillis(150))
            .message());
  }

  @Test
  void allMismatches_joinedInCheckOrder() {
    var expectation =
        new Expectation(200, null, List.of("ok"), null, Map.of("X-Id", "1"), 10L);

    var verdict =
        ExpectationVerifier.verify(
            expectation, response(503, "down", Map.of()), Duration.ofMillis(40));

    assertEquals(
        "Status code mismatch: expected 200, got 503; Body missing expected string: 'ok'; "
            + "Header 'X-Id' not found; Response time 40ms exceeded max 10ms",
        verdict.message());
  }
}
