package com.mk.fx.qa.probe.execution.executors.load;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.probe.execution.executors.ScenarioInvoker;
import com.mk.fx.qa.probe.execution.metrics.ErrorTracker;
import com.mk.fx.qa.probe.execution.metrics.ResultCollector;
import com.mk.fx.qa.probe.execution.model.ExecutionMetrics;
import com.mk.fx.qa.probe.execution.model.RunConfig;
import com.mk.fx.qa.probe.execution.model.RunState;
import com.mk.fx.qa.probe.execution.model.ScenarioDescriptor;
import com.mk.fx.qa.probe.execution.model.TargetDescriptor;
import com.mk.fx.qa.probe.execution.probe.Probe;
import com.mk.fx.qa.probe.execution.probe.ProbeResponse;
import com.mk.fx.qa.probe.execution.verdict.Verdict;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs continuous virtual-user traffic against a set of targets until a deadline passes or the run
 * is cancelled, then reports aggregated metrics.
 *
 * <p>Threading: a fixed pool of one thread per virtual user. Each user loops over the targets
 * round-robin (its own index, starting at {@code userIndex % targets}), invoking the probe and
 * recording one outcome per call. With a target rate set, each user pauses {@code 1s / rate}
 * between its own calls, so the attempted aggregate rate is {@code concurrency * rate}.
 *
 * <p>Lifecycle: {@code IDLE -> RUNNING -> STOPPING -> DONE}. The stop signal is only observed
 * between iterations; in-flight probe calls always complete. A runner instance runs once.
 */
@Slf4j
public class DurationLoadRunner {

  private static final long STOP_POLL_MILLIS = 50L;
  private static final long SLEEP_CHUNK_MILLIS = 100L;
  private static final Duration DEFAULT_SNAPSHOT_INTERVAL = Duration.ofSeconds(5);

  private final UUID runId;
  private final RunConfig config;
  private final Probe probe;
  private final Duration snapshotInterval;

  private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
  private final AtomicBoolean stopSignal = new AtomicBoolean(false);
  private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
  private final AtomicInteger activeUsers = new AtomicInteger();
  private final ResultCollector collector = new ResultCollector();
  private final ErrorTracker errorTracker = new ErrorTracker();

  private volatile long startNanos;
  private volatile ExecutionMetrics finalMetrics;

  public DurationLoadRunner(UUID runId, RunConfig config, Probe probe) {
    this(runId, config, probe, DEFAULT_SNAPSHOT_INTERVAL);
  }

  /**
   * Creates a runner.
   *
   * @param runId identifier used for thread names and logs
   * @param config run configuration; unset values are resolved from its profile
   * @param probe performs each invocation
   * @param snapshotInterval how often progress is logged while running
   */
  public DurationLoadRunner(
      UUID runId, RunConfig config, Probe probe, Duration snapshotInterval) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.config = Objects.requireNonNull(config, "config").resolve();
    this.probe = Objects.requireNonNull(probe, "probe");
    this.snapshotInterval = Objects.requireNonNull(snapshotInterval, "snapshotInterval");
    if (snapshotInterval.isZero() || snapshotInterval.isNegative()) {
      throw new IllegalArgumentException("snapshotInterval must be positive");
    }
  }

  public UUID runId() {
    return runId;
  }

  public RunConfig config() {
    return config;
  }

  public RunState state() {
    return state.get();
  }

  /**
   * Requests the run to stop. Virtual users finish their current invocation and exit.
   *
   * @return false if the run had already finished
   */
  public boolean cancel() {
    if (state.get() == RunState.DONE) {
      return false;
    }
    if (cancelRequested.compareAndSet(false, true)) {
      log.info("Load run {} cancellation requested in state {}", runId, state.get());
    }
    return true;
  }

  /** Virtual users currently looping. */
  public int activeUsers() {
    return activeUsers.get();
  }

  /** Live metrics while running, the final metrics once done. */
  public ExecutionMetrics snapshot() {
    var done = finalMetrics;
    if (done != null) {
      return done;
    }
    if (state.get() == RunState.IDLE) {
      return ExecutionMetrics.empty();
    }
    return collector.snapshot(elapsed());
  }

  /**
   * Runs the load until the configured duration elapses or {@link #cancel()} is called, joining
   * every virtual user before returning. If the calling thread is interrupted the run is treated
   * as cancelled and the interrupt flag is restored on return.
   *
   * @param targets endpoints to rotate through, must not be empty
   * @return aggregated result of the run
   * @throws IllegalArgumentException if {@code targets} is empty
   * @throws IllegalStateException if this runner has already been started
   */
  public LoadRunResult run(List<TargetDescriptor> targets) {
    Objects.requireNonNull(targets, "targets");
    if (targets.isEmpty()) {
      throw new IllegalArgumentException("At least one target is required for a load run");
    }
    if (!state.compareAndSet(RunState.IDLE, RunState.RUNNING)) {
      throw new IllegalStateException("Load run " + runId + " has already been started");
    }

    List<ScenarioDescriptor> scenarios =
        targets.stream().map(TargetDescriptor::toScenario).toList();
    var users = config.concurrency();
    var startedAt = Instant.now();
    startNanos = System.nanoTime();
    var deadline = startNanos + config.duration().toNanos();
    logStart(scenarios);

    var executor = newFixedThreadPool(users, threadFactory("load-run-" + runId + "-"));
    ScheduledExecutorService snapshots =
        Executors.newSingleThreadScheduledExecutor(threadFactory("load-snapshots-" + runId + "-"));
    snapshots.scheduleAtFixedRate(
        this::logSnapshot,
        snapshotInterval.toMillis(),
        snapshotInterval.toMillis(),
        TimeUnit.MILLISECONDS);

    var interrupted = false;
    try {
      for (int userIndex = 0; userIndex < users; userIndex++) {
        final var currentUser = userIndex;
        executor.execute(() -> runVirtualUser(currentUser, scenarios));
      }
      awaitStop(deadline);
    } catch (InterruptedException e) {
      interrupted = true;
      cancelRequested.set(true);
      log.info("Load run {} interrupted, stopping virtual users", runId);
    } finally {
      stopSignal.set(true);
      state.compareAndSet(RunState.RUNNING, RunState.STOPPING);
      snapshots.shutdownNow();
      interrupted |= joinUsers(executor);
    }

    var elapsed = elapsed();
    var metrics = collector.finalizeMetrics(elapsed);
    finalMetrics = metrics;
    state.set(RunState.DONE);
    var result =
        new LoadRunResult(
            runId.toString(),
            config,
            targets.stream().map(TargetDescriptor::key).toList(),
            metrics,
            errorTracker.breakdownSnapshot(),
            errorTracker.samplesSnapshot(),
            cancelRequested.get(),
            startedAt,
            Instant.now(),
            elapsed);
    logFinalSummary(result);

    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    return result;
  }

  /** Loops one virtual user until the stop signal is raised. */
  private void runVirtualUser(int userIndex, List<ScenarioDescriptor> scenarios) {
    var next = userIndex % scenarios.size();
    var throttle = config.throttleInterval();
    long iterations = 0;
    activeUsers.incrementAndGet();
    log.debug("Load run {} virtual user {} started", runId, userIndex + 1);
    try {
      while (!stopSignal.get() && !Thread.currentThread().isInterrupted()) {
        var scenario = scenarios.get(next);
        next = (next + 1) % scenarios.size();
        record(ScenarioInvoker.invoke(probe, scenario, DurationLoadRunner::judge));
        iterations++;
        if (!throttle.isZero() && !pause(throttle)) {
          break;
        }
      }
    } catch (RuntimeException ex) {
      log.error(
          "Load run {} virtual user {} failed after {} iterations: {} - stopping this user",
          runId,
          userIndex + 1,
          iterations,
          ex.getMessage(),
          ex);
    } finally {
      var remaining = activeUsers.decrementAndGet();
      log.debug(
          "Load run {} virtual user {} stopped after {} iterations ({} still active)",
          runId,
          userIndex + 1,
          iterations,
          remaining);
    }
  }

  private void record(ScenarioInvoker.Invocation invocation) {
    var outcome = invocation.outcome();
    collector.record(outcome.withoutBody());
    if (invocation.failure() != null) {
      errorTracker.recordFailure(invocation.failure());
    } else if (!outcome.success()) {
      errorTracker.recordHttpFailure(outcome.actualStatus());
    }
  }

  /** A load-run response passes unless its status marks a client or server error. */
  @VisibleForTesting
  static Verdict judge(ProbeResponse response, Duration latency) {
    if (response.statusCode() >= 400) {
      return new Verdict(List.of("HTTP status " + response.statusCode()));
    }
    return Verdict.passed();
  }

  /** Waits until the deadline passes or cancellation is requested. */
  private void awaitStop(long deadline) throws InterruptedException {
    while (true) {
      if (cancelRequested.get()) {
        log.info("Load run {} stopping on cancellation", runId);
        return;
      }
      var remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        log.info("Load run {} reached its deadline of {}", runId, config.duration());
        return;
      }
      var poll = TimeUnit.MILLISECONDS.toNanos(STOP_POLL_MILLIS);
      TimeUnit.NANOSECONDS.sleep(Math.min(remaining, poll));
    }
  }

  /**
   * Sleeps between invocations in chunks, returning early once the stop signal is raised.
   *
   * @return false if the user should exit
   */
  private boolean pause(Duration duration) {
    long remaining = duration.toNanos();
    try {
      while (remaining > 0) {
        if (stopSignal.get()) {
          return false;
        }
        var chunk = Math.min(TimeUnit.MILLISECONDS.toNanos(SLEEP_CHUNK_MILLIS), remaining);
        TimeUnit.NANOSECONDS.sleep(chunk);
        remaining -= chunk;
      }
      return true;
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Waits for every virtual user to return. Keeps waiting through interrupts so no worker is left
   * behind.
   *
   * @return true if the waiting thread was interrupted
   */
  private boolean joinUsers(ExecutorService executor) {
    executor.shutdown();
    var interrupted = false;
    while (true) {
      try {
        if (executor.awaitTermination(30, TimeUnit.SECONDS)) {
          return interrupted;
        }
        log.warn(
            "Load run {} waiting for {} virtual users to finish in-flight calls",
            runId,
            activeUsers.get());
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
  }

  private Duration elapsed() {
    var start = startNanos;
    return start == 0 ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - start);
  }

  private static ThreadFactory threadFactory(String prefix) {
    var counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private void logStart(List<ScenarioDescriptor> scenarios) {
    var sb = new StringBuilder();
    sb.append("Load run ")
        .append(runId)
        .append(" started: profile=")
        .append(config.profile())
        .append(", users=")
        .append(config.concurrency())
        .append(", duration=")
        .append(config.duration())
        .append(", targets=")
        .append(scenarios.size());
    if (config.throttled()) {
      sb.append(", ratePerUser=")
          .append(String.format("%.2f", config.targetRatePerSec()))
          .append("/s, expectedRps=")
          .append(String.format("%.2f", config.targetRatePerSec() * config.concurrency()));
    }
    log.info(sb.toString());
  }

  private void logSnapshot() {
    var metrics = collector.snapshot(elapsed());
    log.info(
        "Load run {} snapshot: state={}, activeUsers={}, requests={}, errors={}, rps={},"
            + " lat(ms) min={}, avg={}, max={}, p95={}",
        runId,
        state.get(),
        activeUsers.get(),
        metrics.total(),
        metrics.fail(),
        String.format("%.2f", metrics.requestsPerSecond()),
        String.format("%.1f", metrics.minLatencyMs()),
        String.format("%.1f", metrics.avgLatencyMs()),
        String.format("%.1f", metrics.maxLatencyMs()),
        String.format("%.1f", metrics.p95Ms()));
  }

  private void logFinalSummary(LoadRunResult result) {
    var metrics = result.metrics();
    var sb = new StringBuilder();
    sb.append("Load run ")
        .append(runId)
        .append(" summary: profile=")
        .append(config.profile())
        .append(", users=")
        .append(config.concurrency())
        .append(", elapsed=")
        .append(result.elapsed().toMillis())
        .append("ms, cancelled=")
        .append(result.cancelled())
        .append(", requests=")
        .append(metrics.total())
        .append(", success=")
        .append(metrics.success())
        .append(", fail=")
        .append(metrics.fail())
        .append(String.format(", successRate=%.2f%%", metrics.successRate()))
        .append(String.format(", rps=%.2f", metrics.requestsPerSecond()))
        .append(String.format(", lat(ms) min=%.1f", metrics.minLatencyMs()))
        .append(String.format(", avg=%.1f", metrics.avgLatencyMs()))
        .append(String.format(", max=%.1f", metrics.maxLatencyMs()))
        .append(String.format(", p50=%.1f", metrics.p50Ms()))
        .append(String.format(", p95=%.1f", metrics.p95Ms()))
        .append(String.format(", p99=%.1f", metrics.p99Ms()));
    if (!result.errorBreakdown().isEmpty()) {
      sb.append(", errors=").append(result.errorBreakdown());
    }
    log.info(sb.toString());
  }
}
