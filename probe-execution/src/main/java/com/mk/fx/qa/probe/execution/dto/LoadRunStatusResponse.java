package com.mk.fx.qa.probe.execution.dto;

import com.mk.fx.qa.probe.execution.executors.load.LoadRunResult;
import com.mk.fx.qa.probe.execution.model.ExecutionMetrics;
import com.mk.fx.qa.probe.execution.model.RunConfig;
import com.mk.fx.qa.probe.execution.model.RunState;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Status of a load run. {@code metrics} are live while the run is in progress; {@code result} is
 * present once it is done, {@code errorMessage} if it failed to run at all.
 */
public record LoadRunStatusResponse(
    UUID runId,
    RunState state,
    RunConfig config,
    List<String> targets,
    Instant submittedAt,
    ExecutionMetrics metrics,
    LoadRunResult result,
    String errorMessage) {}
