package com.mk.fx.qa.probe.execution.resource;

import com.mk.fx.qa.probe.execution.dto.BatchRunReport;
import com.mk.fx.qa.probe.execution.dto.BatchRunRequest;
import com.mk.fx.qa.probe.execution.dto.LoadRunCancellationResponse;
import com.mk.fx.qa.probe.execution.dto.LoadRunRequest;
import com.mk.fx.qa.probe.execution.dto.LoadRunStatusResponse;
import com.mk.fx.qa.probe.execution.dto.LoadRunSubmissionResponse;
import com.mk.fx.qa.probe.execution.model.RunState;
import com.mk.fx.qa.probe.execution.service.ProbeExecutionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(
    name = "Probe Runs",
    description = "Endpoints for running scenario batches and managing load runs")
@RestController
@RequestMapping("/api")
@Validated
@RequiredArgsConstructor
public class ProbeRunController {

  private final ProbeExecutionService executionService;
  private final RunRequestMapper requestMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Batch runs
  // -----------------------------------------------------
  @Operation(
      summary = "Run a scenario batch",
      description = "Runs every selected scenario with bounded concurrency and returns the report.")
  @PostMapping("/batch-runs")
  public ResponseEntity<BatchRunReport> runBatch(@Valid @RequestBody BatchRunRequest request)
      throws InterruptedException {
    log.info(
        "Received batch run of {} scenarios against {}",
        request.getScenarios().size(),
        request.getBaseUrl());
    var report = executionService.runBatch(requestMapper.toBatchCommand(request));
    return responseFactory.ok(report);
  }

  // -----------------------------------------------------
  // Load runs
  // -----------------------------------------------------
  @Operation(
      summary = "Start a load run",
      description = "Starts a duration-bound load run in the background.")
  @PostMapping("/load-runs")
  public ResponseEntity<LoadRunSubmissionResponse> startLoad(
      @Valid @RequestBody LoadRunRequest request) {
    log.info(
        "Received load run profile={} against {} ({} endpoints)",
        request.getProfile(),
        request.getBaseUrl(),
        request.getEndpoints().size());
    var runId = executionService.startLoad(requestMapper.toLoadCommand(request));
    return responseFactory.accepted(
        new LoadRunSubmissionResponse(runId, RunState.IDLE, "Load run accepted"));
  }

  @Operation(summary = "List load runs", description = "Lists active and recently finished runs.")
  @GetMapping("/load-runs")
  public ResponseEntity<List<LoadRunStatusResponse>> getLoadRuns() {
    return responseFactory.ok(executionService.getLoadRuns());
  }

  @Operation(
      summary = "Get load run status",
      description = "Returns live metrics while running and the final result once done.")
  @GetMapping("/load-runs/{runId}")
  public ResponseEntity<?> getLoadRun(@PathVariable UUID runId) {
    return executionService
        .getLoadRun(runId)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Load run {} not found", runId);
              return responseFactory.error(
                  HttpStatus.NOT_FOUND, "Not Found", "Load run not found: " + runId);
            });
  }

  @Operation(summary = "Cancel load run", description = "Stops a load run early.")
  @DeleteMapping("/load-runs/{runId}")
  public ResponseEntity<?> cancelLoad(@PathVariable UUID runId) {
    var result = executionService.cancelLoad(runId);
    log.info("Cancellation requested for load run {} -> {}", runId, result.getState());
    return switch (result.getState()) {
      case NOT_FOUND -> responseFactory.error(
          HttpStatus.NOT_FOUND, "Not Found", "Load run not found: " + runId);
      case NOT_CANCELLABLE -> responseFactory.error(
          HttpStatus.CONFLICT, "Conflict", "Load run has already finished");
      case CANCELLATION_REQUESTED -> responseFactory.ok(
          new LoadRunCancellationResponse(runId, result.getRunState(), "Cancellation requested"));
    };
  }
}
