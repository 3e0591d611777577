package com.mk.fx.qa.probe.execution.executors.batch;

import com.mk.fx.qa.probe.execution.executors.ScenarioInvoker;
import com.mk.fx.qa.probe.execution.model.InvocationOutcome;
import com.mk.fx.qa.probe.execution.model.ScenarioDescriptor;
import com.mk.fx.qa.probe.execution.probe.Probe;
import com.mk.fx.qa.probe.execution.verdict.ExpectationVerifier;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a fixed set of scenarios with at most {@code concurrency} invocations in flight and returns
 * one outcome per scenario, in input order.
 *
 * <p>Threading: the calling thread acquires a permit from a counting {@link Semaphore} before
 * dispatching each scenario to a cached pool; the worker releases it as soon as its invocation
 * returns. The call blocks until every scenario has an outcome. A failing probe call only fails its
 * own outcome.
 */
@Slf4j
public final class BoundedBatchRunner {

  public static final int DEFAULT_CONCURRENCY = 5;

  private BoundedBatchRunner() {
    throw new UnsupportedOperationException("BoundedBatchRunner cannot be instantiated");
  }

  /**
   * Runs a batch.
   *
   * @param runId identifier used for thread names and logs
   * @param scenarios scenarios to run, must not be empty
   * @param concurrency ceiling on simultaneous invocations; values {@code <= 0} fall back to
   *     {@link #DEFAULT_CONCURRENCY}
   * @param probe performs each invocation
   * @return outcomes where {@code outcomes.get(i)} belongs to {@code scenarios.get(i)}
   * @throws IllegalArgumentException if {@code scenarios} is empty
   * @throws InterruptedException if the calling thread is interrupted while dispatching or joining;
   *     already dispatched invocations are allowed to finish first
   */
  public static List<InvocationOutcome> execute(
      UUID runId, List<ScenarioDescriptor> scenarios, int concurrency, Probe probe)
      throws InterruptedException {
    validateTask(runId, scenarios, probe);

    var ceiling = concurrency > 0 ? concurrency : DEFAULT_CONCURRENCY;
    var gate = new Semaphore(ceiling);
    var startNanos = System.nanoTime();
    log.info(
        "Batch {} starting {} scenarios with concurrency {}", runId, scenarios.size(), ceiling);

    var threadCounter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("batch-run-" + runId + "-" + threadCounter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };

    var executor = Executors.newCachedThreadPool(threadFactory);
    List<Future<InvocationOutcome>> futures = new ArrayList<>(scenarios.size());
    try {
      for (ScenarioDescriptor scenario : scenarios) {
        gate.acquire();
        try {
          futures.add(executor.submit(() -> runScenario(scenario, probe, gate)));
        } catch (RuntimeException rejected) {
          gate.release();
          throw rejected;
        }
      }
      var outcomes = collect(runId, scenarios, futures);
      logSummary(runId, outcomes, Duration.ofNanos(System.nanoTime() - startNanos));
      return outcomes;
    } finally {
      shutdownAndDrain(executor, runId);
    }
  }

  private static void validateTask(UUID runId, List<ScenarioDescriptor> scenarios, Probe probe) {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(scenarios, "scenarios");
    Objects.requireNonNull(probe, "probe");
    if (scenarios.isEmpty()) {
      throw new IllegalArgumentException("At least one scenario is required");
    }
    for (int i = 0; i < scenarios.size(); i++) {
      Objects.requireNonNull(scenarios.get(i), "scenarios[" + i + "]");
    }
  }

  /** Invokes one scenario and hands its permit back whatever happens. */
  private static InvocationOutcome runScenario(
      ScenarioDescriptor scenario, Probe probe, Semaphore gate) {
    try {
      return ScenarioInvoker.invoke(
              probe,
              scenario,
              (response, latency) ->
                  ExpectationVerifier.verify(scenario.expectation(), response, latency))
          .outcome();
    } finally {
      gate.release();
    }
  }

  /** Joins every future in input order so outcome positions match scenario positions. */
  private static List<InvocationOutcome> collect(
      UUID runId, List<ScenarioDescriptor> scenarios, List<Future<InvocationOutcome>> futures)
      throws InterruptedException {
    List<InvocationOutcome> outcomes = new ArrayList<>(futures.size());
    for (int i = 0; i < futures.size(); i++) {
      try {
        outcomes.add(futures.get(i).get());
      } catch (ExecutionException ex) {
        var cause = ex.getCause() != null ? ex.getCause() : ex;
        var scenarioId = scenarios.get(i).id();
        log.error("Batch {} scenario {} crashed: {}", runId, scenarioId, cause.toString(), cause);
        outcomes.add(crashed(scenarios.get(i), cause));
      }
    }
    return List.copyOf(outcomes);
  }

  private static InvocationOutcome crashed(ScenarioDescriptor scenario, Throwable cause) {
    var expectation = scenario.expectation();
    return new InvocationOutcome(
        scenario.id(),
        scenario.displayName(),
        scenario.category(),
        false,
        0,
        expectation.checksStatus() ? expectation.statusCode() : 0,
        Duration.ZERO,
        "Request failed: " + cause,
        null,
        Instant.now());
  }

  private static void logSummary(UUID runId, List<InvocationOutcome> outcomes, Duration elapsed) {
    long passed = outcomes.stream().filter(InvocationOutcome::success).count();
    log.info(
        "Batch {} completed {} scenarios in {} ms: passed={} failed={}",
        runId,
        outcomes.size(),
        elapsed.toMillis(),
        passed,
        outcomes.size() - passed);
  }

  /** Lets in-flight invocations finish; never interrupts them. */
  private static void shutdownAndDrain(ExecutorService executor, UUID runId)
      throws InterruptedException {
    executor.shutdown();
    while (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
      log.warn("Batch {} still waiting for in-flight invocations to finish", runId);
    }
  }
}
