package com.mk.fx.qa.probe.execution.executors.load;

import com.mk.fx.qa.probe.execution.metrics.ErrorTracker;
import com.mk.fx.qa.probe.execution.model.ExecutionMetrics;
import com.mk.fx.qa.probe.execution.model.RunConfig;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final result of a duration-bound load run.
 *
 * @param runId run identifier
 * @param config the resolved configuration the run used
 * @param targets keys of the targets that were rotated through
 * @param metrics aggregated metrics over every invocation
 * @param errorBreakdown failure category to count
 * @param errorSamples first distinct failures seen
 * @param cancelled true if the run stopped on an external cancel rather than its deadline
 * @param startedAt when virtual users were launched
 * @param finishedAt when the last virtual user returned
 * @param elapsed wall-clock duration from start to finish
 */
public record LoadRunResult(
    String runId,
    RunConfig config,
    List<String> targets,
    ExecutionMetrics metrics,
    Map<String, Long> errorBreakdown,
    List<ErrorTracker.ErrorSample> errorSamples,
    boolean cancelled,
    Instant startedAt,
    Instant finishedAt,
    Duration elapsed) {}
