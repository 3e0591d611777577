package com.mk.fx.qa.probe.execution.dto;

import com.mk.fx.qa.probe.execution.model.ExecutionMetrics;
import com.mk.fx.qa.probe.execution.model.InvocationOutcome;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Result of a batch run: per-scenario outcomes in request order plus aggregate metrics.
 *
 * @param runId identifier of the run, as it appears in logs
 * @param concurrency ceiling that was applied
 * @param startedAt when dispatch began
 * @param finishedAt when the last outcome was collected
 * @param metrics aggregate metrics over every outcome
 * @param outcomes one outcome per scenario, {@code outcomes[i]} for {@code scenarios[i]}
 */
public record BatchRunReport(
    UUID runId,
    int concurrency,
    Instant startedAt,
    Instant finishedAt,
    ExecutionMetrics metrics,
    List<InvocationOutcome> outcomes) {}
