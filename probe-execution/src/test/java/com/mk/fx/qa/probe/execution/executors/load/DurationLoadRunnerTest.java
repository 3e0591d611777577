package com.mk.fx.qa.probe.execution.executors.load;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.probe.execution.model.LoadProfile;
import com.mk.fx.qa.probe.execution.model.RunConfig;
import com.mk.fx.qa.probe.execution.model.RunState;
import com.mk.fx.qa.probe.execution.model.TargetDescriptor;
import com.mk.fx.qa.probe.execution.probe.Probe;
import com.mk.fx.qa.probe.execution.probe.ProbeResponse;
import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;

class DurationLoadRunnerTest {

  private static final List<TargetDescriptor> TARGETS =
      List.of(TargetDescriptor.parse("GET /a"), TargetDescriptor.parse("POST /b"));

  private static RunConfig config(int users, Duration duration, Double rate) {
    return new RunConfig(LoadProfile.LOAD, users, duration, rate);
  }

  /** Probe that takes a millisecond so runs stay small. */
  private static Probe sleepingProbe(int status) {
    return descriptor -> {
      Thread.sleep(1);
      return ProbeResponse.of(status);
    };
  }

  @Test
  void runsForDuration_andJoinsAllUsers() {
    var activeThreads = ConcurrentHashMap.<String>newKeySet();
    var inFlight = new AtomicInteger();
    Probe probe =
        descriptor -> {
          activeThreads.add(Thread.currentThread().getName());
          inFlight.incrementAndGet();
          try {
            Thread.sleep(2);
          } finally {
            inFlight.decrementAndGet();
          }
          return ProbeResponse.of(200);
        };
    var runner =
        new DurationLoadRunner(UUID.randomUUID(), config(3, Duration.ofSeconds(2), null), probe);

    long start = System.nanoTime();
    var result = runner.run(TARGETS);
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertTrue(elapsedMs >= 2000, "finished early after " + elapsedMs + "ms");
    assertTrue(elapsedMs < 2500, "took " + elapsedMs + "ms");
    assertEquals(0, inFlight.get());
    assertEquals(3, activeThreads.size());
    assertEquals(RunState.DONE, runner.state());
    assertFalse(result.cancelled());
    assertTrue(result.metrics().total() > 0);
    assertEquals(result.metrics().total(), result.metrics().success());
    assertEquals(100.0, result.metrics().successRate());
    assertEquals(List.of("GET /a", "POST /b"), result.targets());
  }

  @Test
  void cancel_stopsRunBeforeDeadline() throws Exception {
    var runner =
        new DurationLoadRunner(
            UUID.randomUUID(), config(2, Duration.ofSeconds(30), null), sleepingProbe(200));
    var pool = Executors.newSingleThreadExecutor();
    try {
      Future<LoadRunResult> future = pool.submit(() -> runner.run(TARGETS));
      Thread.sleep(200);
      assertEquals(RunState.RUNNING, runner.state());
      assertTrue(runner.cancel());

      var result = future.get(5, TimeUnit.SECONDS);

      assertTrue(result.cancelled());
      assertTrue(result.elapsed().compareTo(Duration.ofSeconds(5)) < 0);
      assertEquals(RunState.DONE, runner.state());
      assertFalse(runner.cancel());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void activeUsers_countsOnlyStartedUsers_andDropsToZero() throws Exception {
    var runner =
        new DurationLoadRunner(
            UUID.randomUUID(), config(3, Duration.ofSeconds(30), null), sleepingProbe(200));
    assertEquals(0, runner.activeUsers());
    var pool = Executors.newSingleThreadExecutor();
    try {
      Future<LoadRunResult> future = pool.submit(() -> runner.run(TARGETS));
      Awaitility.await()
          .atMost(5, TimeUnit.SECONDS)
          .untilAsserted(() -> assertEquals(3, runner.activeUsers()));

      runner.cancel();
      future.get(5, TimeUnit.SECONDS);

      assertEquals(0, runner.activeUsers());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void throttledUsers_stayNearTargetRate() {
    var calls = new AtomicInteger();
    Probe probe =
        descriptor -> {
          calls.incrementAndGet();
          return ProbeResponse.of(200);
        };
    // 2 users at 10/s each for 1s
    var runner =
        new DurationLoadRunner(UUID.randomUUID(), config(2, Duration.ofSeconds(1), 10.0), probe);

    var result = runner.run(TARGETS);

    assertEquals(calls.get(), result.metrics().total());
    assertTrue(calls.get() >= 10, "too few calls: " + calls.get());
    assertTrue(calls.get() <= 26, "too many calls: " + calls.get());
  }

  @Test
  void roundRobin_coversEveryTarget() {
    var seen = ConcurrentHashMap.<String>newKeySet();
    Probe probe =
        descriptor -> {
          seen.add(descriptor.method() + " " + descriptor.target());
          Thread.sleep(1);
          return ProbeResponse.of(200);
        };
    var runner =
        new DurationLoadRunner(
            UUID.randomUUID(), config(1, Duration.ofMillis(300), null), probe);

    runner.run(TARGETS);

    assertEquals(Set.of("GET /a", "POST /b"), seen);
  }

  @Test
  void failures_areCountedAndClassified() {
    var counter = new AtomicInteger();
    Probe probe =
        descriptor -> {
          Thread.sleep(1);
          int n = counter.incrementAndGet();
          if (n % 3 == 0) {
            throw new ConnectException("Connection refused");
          }
          return ProbeResponse.of(n % 3 == 1 ? 200 : 503);
        };
    var runner =
        new DurationLoadRunner(UUID.randomUUID(), config(1, Duration.ofMillis(500), null), probe);

    var result = runner.run(TARGETS);

    var metrics = result.metrics();
    assertTrue(metrics.fail() > 0);
    assertEquals(metrics.total(), metrics.success() + metrics.fail());
    assertTrue(result.errorBreakdown().containsKey("CONNECTION_REFUSED"));
    assertTrue(result.errorBreakdown().containsKey("HTTP_5xx"));
    assertEquals(
        metrics.fail(), result.errorBreakdown().values().stream().mapToLong(Long::longValue).sum());
  }

  @Test
  void stateMovesThroughLifecycle() throws Exception {
    var started = new CountDownLatch(1);
    Probe probe =
        descriptor -> {
          started.countDown();
          Thread.sleep(1);
          return ProbeResponse.of(200);
        };
    var runner =
        new DurationLoadRunner(UUID.randomUUID(), config(1, Duration.ofMillis(400), null), probe);
    assertEquals(RunState.IDLE, runner.state());
    assertEquals(0, runner.snapshot().total());

    var pool = Executors.newSingleThreadExecutor();
    try {
      var future = pool.submit(() -> runner.run(TARGETS));
      assertTrue(started.await(2, TimeUnit.SECONDS));
      assertEquals(RunState.RUNNING, runner.state());

      var result = future.get(5, TimeUnit.SECONDS);
      assertEquals(RunState.DONE, runner.state());
      assertEquals(result.metrics(), runner.snapshot());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void runnerRunsOnlyOnce() {
    var runner =
        new DurationLoadRunner(
            UUID.randomUUID(), config(1, Duration.ofMillis(100), null), sleepingProbe(200));
    runner.run(TARGETS);

    assertThrows(IllegalStateException.class, () -> runner.run(TARGETS));
  }

  @Test
  void emptyTargets_areRejected() {
    var runner =
        new DurationLoadRunner(
            UUID.randomUUID(), config(1, Duration.ofMillis(100), null), sleepingProbe(200));

    assertThrows(IllegalArgumentException.class, () -> runner.run(List.of()));
    assertEquals(RunState.IDLE, runner.state());
  }

  @Test
  void unsetValues_resolveFromProfile() {
    var runner =
        new DurationLoadRunner(
            UUID.randomUUID(), RunConfig.of(LoadProfile.SPIKE), sleepingProbe(200));

    assertEquals(100, runner.config().concurrency());
    assertEquals(Duration.ofSeconds(10), runner.config().duration());
    assertFalse(runner.config().throttled());
  }

  @Test
  void judge_failsOnClientAndServerErrors() {
    assertTrue(DurationLoadRunner.judge(ProbeResponse.of(200), Duration.ZERO).isPassed());
    assertTrue(DurationLoadRunner.judge(ProbeResponse.of(302), Duration.ZERO).isPassed());
    var verdict = DurationLoadRunner.judge(ProbeResponse.of(404), Duration.ZERO);
    assertFalse(verdict.isPassed());
    assertEquals("HTTP status 404", verdict.message());
    assertFalse(DurationLoadRunner.judge(ProbeResponse.of(500), Duration.ZERO).isPassed());
  }
}
