package com.mk.fx.qa.probe.execution.dto;

import com.mk.fx.qa.probe.execution.model.RunState;
import java.util.UUID;

/** Response to a load run cancellation request. */
public record LoadRunCancellationResponse(UUID runId, RunState state, String message) {}
