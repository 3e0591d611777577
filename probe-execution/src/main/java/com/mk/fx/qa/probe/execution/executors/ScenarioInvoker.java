package com.mk.fx.qa.probe.execution.executors;

import com.mk.fx.qa.probe.execution.model.InvocationOutcome;
import com.mk.fx.qa.probe.execution.model.ScenarioDescriptor;
import com.mk.fx.qa.probe.execution.probe.Probe;
import com.mk.fx.qa.probe.execution.probe.ProbeResponse;
import com.mk.fx.qa.probe.execution.verdict.Verdict;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BiFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Invokes a probe for one scenario and turns whatever happens into exactly one {@link
 * InvocationOutcome}. Never throws: probe failures become failed outcomes.
 */
@Slf4j
public final class ScenarioInvoker {

  private ScenarioInvoker() {
    throw new UnsupportedOperationException("ScenarioInvoker cannot be instantiated");
  }

  /**
   * Outcome of one invocation plus the probe failure behind it, if any.
   *
   * @param outcome the recorded outcome
   * @param failure exception thrown by the probe, null when a response was received
   */
  public record Invocation(InvocationOutcome outcome, Throwable failure) {}

  /**
   * Invokes the probe and judges the response.
   *
   * @param probe the probe to call
   * @param descriptor scenario being invoked
   * @param judge decides the verdict from the response and its latency
   * @return the invocation, never null
   */
  public static Invocation invoke(
      Probe probe,
      ScenarioDescriptor descriptor,
      BiFunction<ProbeResponse, Duration, Verdict> judge) {
    var startedAt = Instant.now();
    long start = System.nanoTime();
    var expectedStatus =
        descriptor.expectation().checksStatus() ? descriptor.expectation().statusCode() : 0;
    try {
      var response = probe.invoke(descriptor);
      var measured = elapsedSince(start);
      if (response == null) {
        return failed(
            descriptor,
            expectedStatus,
            measured,
            startedAt,
            new IllegalStateException("Probe returned no response"));
      }
      var latency = response.latency().isZero() ? measured : response.latency();
      var verdict = judge.apply(response, latency);
      log.debug(
          "Scenario {} returned {} in {} ms (passed={})",
          descriptor.id(),
          response.statusCode(),
          latency.toMillis(),
          verdict.isPassed());
      return new Invocation(
          new InvocationOutcome(
              descriptor.id(),
              descriptor.displayName(),
              descriptor.category(),
              verdict.isPassed(),
              response.statusCode(),
              expectedStatus,
              latency,
              verdict.message(),
              response.body(),
              startedAt),
          null);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return failed(descriptor, expectedStatus, elapsedSince(start), startedAt, interrupted);
    } catch (Exception ex) {
      log.debug("Scenario {} probe failed: {}", descriptor.id(), ex.toString());
      return failed(descriptor, expectedStatus, elapsedSince(start), startedAt, ex);
    }
  }

  private static Duration elapsedSince(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  private static Invocation failed(
      ScenarioDescriptor descriptor,
      int expectedStatus,
      Duration latency,
      Instant startedAt,
      Throwable failure) {
    var message = failure.getMessage();
    if (message == null || message.isBlank()) {
      message = failure.getClass().getSimpleName();
    }
    return new Invocation(
        new InvocationOutcome(
            descriptor.id(),
            descriptor.displayName(),
            descriptor.category(),
            false,
            0,
            expectedStatus,
            latency,
            "Request failed: " + message,
            null,
            startedAt),
        failure);
  }
}
