package com.mk.fx.qa.probe.execution.service;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.probe.execution.cfg.ProbeEngineCfg;
import com.mk.fx.qa.probe.execution.dto.BatchRunReport;
import com.mk.fx.qa.probe.execution.dto.LoadRunStatusResponse;
import com.mk.fx.qa.probe.execution.executors.batch.BoundedBatchRunner;
import com.mk.fx.qa.probe.execution.executors.load.DurationLoadRunner;
import com.mk.fx.qa.probe.execution.executors.load.LoadRunResult;
import com.mk.fx.qa.probe.execution.metrics.ResultCollector;
import com.mk.fx.qa.probe.execution.model.BatchRunCommand;
import com.mk.fx.qa.probe.execution.model.LoadRunCommand;
import com.mk.fx.qa.probe.execution.model.RunConfig;
import com.mk.fx.qa.probe.execution.model.RunState;
import com.mk.fx.qa.probe.execution.model.ScenarioDescriptor;
import com.mk.fx.qa.probe.execution.model.TargetDescriptor;
import com.mk.fx.qa.probe.execution.probe.Probe;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for both execution modes.
 *
 * <p>Batch runs execute synchronously on the caller's thread and return their report. Load runs
 * are handed to a bounded worker pool, one pool thread per active run, and tracked in memory by run
 * id until they fall out of the finished-run history.
 */
@Slf4j
@Service
public class ProbeExecutionService {

  private final ProbeEngineCfg properties;
  private final ProbeFactory probeFactory;
  private final ThreadPoolExecutor loadExecutor;
  private final Map<UUID, LoadRunRecord> loadRuns = new ConcurrentHashMap<>();
  private final Deque<UUID> finishedRuns = new ConcurrentLinkedDeque<>();
  private final AtomicInteger activeLoadRuns = new AtomicInteger();
  private final AtomicBoolean acceptingRuns = new AtomicBoolean(true);

  public ProbeExecutionService(ProbeEngineCfg properties, ProbeFactory probeFactory) {
    this.properties = properties;
    this.probeFactory = probeFactory;
    this.loadExecutor = createExecutor(properties.getMaxActiveLoadRuns());
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "ProbeExecutionService initialised with batchConcurrency={} maxActiveLoadRuns={}"
            + " historySize={}",
        properties.getBatchConcurrency(),
        properties.getMaxActiveLoadRuns(),
        properties.getHistorySize());
  }

  private ThreadPoolExecutor createExecutor(int concurrency) {
    var counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("load-run-coordinator-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };

    ThreadPoolExecutor pool = (ThreadPoolExecutor) newFixedThreadPool(concurrency, threadFactory);
    pool.setRejectedExecutionHandler(
        (runnable, exec) -> {
          throw new RejectedExecutionException("Load run pool is full");
        });
    return pool;
  }

  // -----------------------------------------------------
  // Batch mode
  // -----------------------------------------------------

  /**
   * Runs every scenario selected by the command's category filters and blocks until all have an
   * outcome.
   *
   * @throws IllegalArgumentException if the base URL is blank or no scenario is selected
   * @throws InterruptedException if the calling thread is interrupted while the batch runs
   */
  public BatchRunReport runBatch(BatchRunCommand command) throws InterruptedException {
    requireBaseUrl(command.baseUrl());
    var scenarios = selectScenarios(command);
    var concurrency =
        command.concurrency() != null && command.concurrency() > 0
            ? command.concurrency()
            : properties.getBatchConcurrency();
    var runId = UUID.randomUUID();

    var probe = probeFactory.create(command.baseUrl(), command.headers(), command.variables());
    var startedAt = Instant.now();
    var startNanos = System.nanoTime();
    try {
      var outcomes = BoundedBatchRunner.execute(runId, scenarios, concurrency, probe);
      var elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

      var collector = new ResultCollector();
      outcomes.forEach(collector::record);
      var metrics = collector.finalizeMetrics(elapsed);
      log.info(
          "Batch {} against {}: total={} passed={} failed={} successRate={}",
          runId,
          command.baseUrl(),
          metrics.total(),
          metrics.success(),
          metrics.fail(),
          String.format("%.1f%%", metrics.successRate()));
      return new BatchRunReport(runId, concurrency, startedAt, Instant.now(), metrics, outcomes);
    } finally {
      close(probe, runId);
    }
  }

  /**
   * Applies the single-category filter, then the category set, both case-insensitive.
   *
   * @throws IllegalArgumentException if nothing is left to run
   */
  private List<ScenarioDescriptor> selectScenarios(BatchRunCommand command) {
    if (command.scenarios().isEmpty()) {
      throw new IllegalArgumentException("At least one scenario is required");
    }
    var selected = command.scenarios();
    if (command.category() != null && !command.category().isBlank()) {
      selected =
          selected.stream()
              .filter(scenario -> command.category().equalsIgnoreCase(scenario.category()))
              .toList();
    }
    if (!command.categories().isEmpty()) {
      Set<String> wanted = new HashSet<>();
      command.categories().forEach(category -> wanted.add(category.toLowerCase()));
      selected =
          selected.stream()
              .filter(
                  scenario ->
                      scenario.category() != null
                          && wanted.contains(scenario.category().toLowerCase()))
              .toList();
    }
    if (selected.isEmpty()) {
      throw new IllegalArgumentException(
          "No scenarios matched the requested categories (" + describeFilter(command) + ")");
    }
    return selected;
  }

  private String describeFilter(BatchRunCommand command) {
    var filters = new ArrayList<String>();
    if (command.category() != null && !command.category().isBlank()) {
      filters.add("category=" + command.category());
    }
    if (!command.categories().isEmpty()) {
      filters.add("categories=" + command.categories());
    }
    return String.join(", ", filters);
  }

  // -----------------------------------------------------
  // Load mode
  // -----------------------------------------------------

  /**
   * Validates the command and starts the run in the background.
   *
   * @return id of the accepted run
   * @throws IllegalArgumentException if the base URL is blank or an endpoint is malformed
   * @throws IllegalStateException if the service is shutting down or the active run limit is hit
   */
  public synchronized UUID startLoad(LoadRunCommand command) {
    requireBaseUrl(command.baseUrl());
    if (command.endpoints().isEmpty()) {
      throw new IllegalArgumentException("At least one endpoint is required for a load run");
    }
    var targets = command.endpoints().stream().map(TargetDescriptor::parse).toList();
    if (!acceptingRuns.get()) {
      throw new IllegalStateException("Service is not accepting new load runs");
    }
    if (activeLoadRuns.get() >= properties.getMaxActiveLoadRuns()) {
      throw new IllegalStateException(
          "Maximum of " + properties.getMaxActiveLoadRuns() + " active load runs reached");
    }

    var runId = UUID.randomUUID();
    var config = limitConcurrency(runId, command.toRunConfig());
    var probe = probeFactory.create(command.baseUrl(), command.headers(), command.variables());
    var runner =
        new DurationLoadRunner(
            runId,
            config,
            probe,
            Duration.ofSeconds(properties.getSnapshotIntervalSeconds()));
    var record = new LoadRunRecord(runner, targets, Instant.now());
    loadRuns.put(runId, record);
    activeLoadRuns.incrementAndGet();
    try {
      loadExecutor.execute(() -> executeLoad(record, probe));
    } catch (RejectedExecutionException ex) {
      activeLoadRuns.decrementAndGet();
      loadRuns.remove(runId);
      close(probe, runId);
      throw new IllegalStateException("Load run rejected: " + ex.getMessage(), ex);
    }
    log.info(
        "Load run {} accepted: profile={} users={} duration={} targets={}",
        runId,
        runner.config().profile(),
        runner.config().concurrency(),
        runner.config().duration(),
        targets.size());
    return runId;
  }

  private RunConfig limitConcurrency(UUID runId, RunConfig requested) {
    var ceiling = properties.getMaxLoadConcurrency();
    var capped = requested.capConcurrency(ceiling);
    if (capped.concurrency() < requested.resolve().concurrency()) {
      log.warn(
          "Load run {} asked for {} users, capped at {}",
          runId,
          requested.resolve().concurrency(),
          ceiling);
    }
    return capped;
  }

  private void executeLoad(LoadRunRecord record, Probe probe) {
    var runId = record.getRunner().runId();
    try {
      record.result = record.getRunner().run(record.getTargets());
    } catch (RuntimeException ex) {
      record.errorMessage = ex.getMessage();
      log.error("Load run {} failed: {}", runId, ex.getMessage(), ex);
    } finally {
      close(probe, runId);
      activeLoadRuns.decrementAndGet();
      addToHistory(runId);
    }
  }

  private void addToHistory(UUID runId) {
    finishedRuns.addFirst(runId);
    while (finishedRuns.size() > properties.getHistorySize()) {
      var evicted = finishedRuns.pollLast();
      if (evicted != null) {
        loadRuns.remove(evicted);
      }
    }
  }

  /** Returns the status of a load run, if it is active or still in the finished-run history. */
  public Optional<LoadRunStatusResponse> getLoadRun(UUID runId) {
    return Optional.ofNullable(loadRuns.get(runId)).map(this::toStatusResponse);
  }

  /** Returns every tracked load run, most recently submitted first. */
  public List<LoadRunStatusResponse> getLoadRuns() {
    return loadRuns.values().stream()
        .sorted(Comparator.comparing(LoadRunRecord::getSubmittedAt).reversed())
        .map(this::toStatusResponse)
        .toList();
  }

  /**
   * Requests cancellation of a load run. Virtual users finish their in-flight call and the run
   * reports the metrics gathered so far.
   */
  public CancellationResult cancelLoad(UUID runId) {
    var record = loadRuns.get(runId);
    if (record == null) {
      return CancellationResult.notFound();
    }
    if (record.getRunner().cancel()) {
      return CancellationResult.cancellationRequested(record.getRunner().state());
    }
    return CancellationResult.notCancellable(record.getRunner().state());
  }

  private LoadRunStatusResponse toStatusResponse(LoadRunRecord record) {
    var runner = record.getRunner();
    var result = record.result;
    return new LoadRunStatusResponse(
        runner.runId(),
        runner.state(),
        runner.config(),
        record.getTargets().stream().map(TargetDescriptor::key).toList(),
        record.getSubmittedAt(),
        result != null ? result.metrics() : runner.snapshot(),
        result,
        record.errorMessage);
  }

  // -----------------------------------------------------
  // Lifecycle
  // -----------------------------------------------------

  /** Stops accepting runs, cancels the active ones and waits briefly for them to wind down. */
  public void shutdown() {
    if (!acceptingRuns.compareAndSet(true, false)) {
      return;
    }
    loadRuns.values().forEach(record -> record.getRunner().cancel());
    loadExecutor.shutdown();
    try {
      if (!loadExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warn("{} load runs still stopping at shutdown", activeLoadRuns.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  private static void requireBaseUrl(String baseUrl) {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("baseUrl is required");
    }
  }

  private static void close(Probe probe, UUID runId) {
    if (probe instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Run {} failed to release its probe: {}", runId, ex.getMessage());
      }
    }
  }

  @Getter
  private static final class LoadRunRecord {
    private final DurationLoadRunner runner;
    private final List<TargetDescriptor> targets;
    private final Instant submittedAt;
    private volatile LoadRunResult result;
    private volatile String errorMessage;

    private LoadRunRecord(
        DurationLoadRunner runner, List<TargetDescriptor> targets, Instant submittedAt) {
      this.runner = runner;
      this.targets = targets;
      this.submittedAt = submittedAt;
    }
  }

  /** Describes the outcome of a cancellation attempt for a load run. */
  @Getter
  public static class CancellationResult {
    public enum CancellationState {
      CANCELLATION_REQUESTED,
      NOT_FOUND,
      NOT_CANCELLABLE
    }

    private final CancellationState state;
    private final RunState runState;

    private CancellationResult(CancellationState state, RunState runState) {
      this.state = state;
      this.runState = runState;
    }

    public static CancellationResult cancellationRequested(RunState state) {
      return new CancellationResult(CancellationState.CANCELLATION_REQUESTED, state);
    }

    public static CancellationResult notFound() {
      return new CancellationResult(CancellationState.NOT_FOUND, null);
    }

    public static CancellationResult notCancellable(RunState state) {
      return new CancellationResult(CancellationState.NOT_CANCELLABLE, state);
    }
  }
}
