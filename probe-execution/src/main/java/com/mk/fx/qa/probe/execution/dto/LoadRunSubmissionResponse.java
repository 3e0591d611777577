package com.mk.fx.qa.probe.execution.dto;

import com.mk.fx.qa.probe.execution.model.RunState;
import java.util.UUID;

/** Acknowledges an accepted load run. */
public record LoadRunSubmissionResponse(UUID runId, RunState state, String message) {}
