package com.mk.fx.qa.probe.execution.metrics;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.probe.execution.model.ExecutionMetrics;
import com.mk.fx.qa.probe.execution.model.InvocationOutcome;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Accumulates outcomes from any number of producer threads behind a single lock. Reductions run on
 * a copy taken under the lock, so producers never wait on a sort.
 *
 * <p>{@link #finalizeMetrics(Duration)} must only be called after every producer has been joined;
 * it closes the collector and any later {@link #record(InvocationOutcome)} fails.
 */
public class ResultCollector {

  private final List<InvocationOutcome> outcomes = new ArrayList<>();
  private final BiFunction<List<InvocationOutcome>, Duration, ExecutionMetrics> reducer;
  private boolean finalized;

  public ResultCollector() {
    this(MetricsFinalizer::summarise);
  }

  @VisibleForTesting
  ResultCollector(BiFunction<List<InvocationOutcome>, Duration, ExecutionMetrics> reducer) {
    this.reducer = Objects.requireNonNull(reducer, "reducer");
  }

  /**
   * Records one outcome.
   *
   * @throws IllegalStateException if the collector has already been finalized
   */
  public synchronized void record(InvocationOutcome outcome) {
    Objects.requireNonNull(outcome, "outcome");
    if (finalized) {
      throw new IllegalStateException(
          "Collector already finalized; outcome " + outcome.scenarioId() + " rejected");
    }
    outcomes.add(outcome);
  }

  public synchronized int size() {
    return outcomes.size();
  }

  /** Metrics over the outcomes recorded so far, without closing the collector. */
  public ExecutionMetrics snapshot(Duration elapsed) {
    List<InvocationOutcome> copy;
    synchronized (this) {
      copy = new ArrayList<>(outcomes);
    }
    return reducer.apply(copy, elapsed);
  }

  /** Copy of the outcomes recorded so far, in arrival order. */
  public synchronized List<InvocationOutcome> outcomes() {
    return List.copyOf(outcomes);
  }

  /**
   * Closes the collector and reduces everything recorded to metrics.
   *
   * @param elapsed wall-clock time of the run, used for throughput
   * @throws IllegalStateException if called twice
   */
  public ExecutionMetrics finalizeMetrics(Duration elapsed) {
    List<InvocationOutcome> copy;
    synchronized (this) {
      if (finalized) {
        throw new IllegalStateException("Collector already finalized");
      }
      finalized = true;
      copy = new ArrayList<>(outcomes);
    }
    return reducer.apply(copy, elapsed);
  }

  public synchronized boolean isFinalized() {
    return finalized;
  }
}
