package com.mk.fx.qa.probe.execution.metrics;

import com.mk.fx.qa.probe.execution.model.ExecutionMetrics;
import com.mk.fx.qa.probe.execution.model.InvocationOutcome;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;

/**
 * Reduces invocation outcomes to {@link ExecutionMetrics}. Pure and stateless.
 *
 * <p>Percentile {@code pN} is the sorted latency at index {@code floor(count * N / 100)}, clamped
 * to the last element so high percentiles of small samples stay in range.
 */
public final class MetricsFinalizer {

  private static final double NANOS_PER_MILLI = 1_000_000.0;

  private MetricsFinalizer() {
    throw new UnsupportedOperationException("MetricsFinalizer cannot be instantiated");
  }

  /**
   * Summarises outcomes.
   *
   * @param outcomes outcomes to reduce, never modified
   * @param elapsed wall-clock time the outcomes were produced in, used for throughput; null or
   *     zero yields a throughput of 0
   * @return the summary, all zeros for an empty sample
   */
  public static ExecutionMetrics summarise(
      Collection<InvocationOutcome> outcomes, Duration elapsed) {
    int count = outcomes.size();
    if (count == 0) {
      return ExecutionMetrics.empty();
    }

    long[] latencies = new long[count];
    long successCount = 0;
    long sum = 0;
    int i = 0;
    for (InvocationOutcome outcome : outcomes) {
      long nanos = outcome.latency().toNanos();
      latencies[i++] = nanos;
      sum += nanos;
      if (outcome.success()) {
        successCount++;
      }
    }
    Arrays.sort(latencies);

    return new ExecutionMetrics(
        count,
        successCount,
        count - successCount,
        successCount * 100.0 / count,
        toMillis(sum) / count,
        toMillis(latencies[0]),
        toMillis(latencies[count - 1]),
        toMillis(percentile(latencies, 50)),
        toMillis(percentile(latencies, 95)),
        toMillis(percentile(latencies, 99)),
        throughput(count, elapsed));
  }

  static long percentile(long[] sorted, int n) {
    int index = (int) Math.min((long) sorted.length * n / 100, sorted.length - 1L);
    return sorted[index];
  }

  private static double throughput(long count, Duration elapsed) {
    if (elapsed == null || elapsed.isZero() || elapsed.isNegative()) {
      return 0;
    }
    return count / (elapsed.toNanos() / 1_000_000_000.0);
  }

  private static double toMillis(long nanos) {
    return nanos / NANOS_PER_MILLI;
  }
}
