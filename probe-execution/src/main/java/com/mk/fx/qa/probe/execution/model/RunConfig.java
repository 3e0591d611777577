package com.mk.fx.qa.probe.execution.model;

import java.time.Duration;

/**
 * Parameters of a duration-bound load run.
 *
 * @param profile load shape supplying defaults, {@link LoadProfile#LOAD} when null
 * @param concurrency number of virtual users, profile default when {@code <= 0}
 * @param duration how long users keep looping, profile default when null or not positive
 * @param targetRatePerSec per-user invocation rate, unthrottled when null or not positive
 */
public record RunConfig(
    LoadProfile profile, int concurrency, Duration duration, Double targetRatePerSec) {

  public static RunConfig of(LoadProfile profile) {
    return new RunConfig(profile, 0, null, null);
  }

  /** Returns a copy with every unset or nonsensical value replaced by the profile default. */
  public RunConfig resolve() {
    var resolvedProfile = profile == null ? LoadProfile.LOAD : profile;
    var resolvedConcurrency = concurrency > 0 ? concurrency : resolvedProfile.defaultConcurrency();
    var resolvedDuration =
        duration == null || duration.isZero() || duration.isNegative()
            ? resolvedProfile.defaultDuration()
            : duration;
    var resolvedRate =
        targetRatePerSec == null || targetRatePerSec.isNaN() || targetRatePerSec <= 0
            ? null
            : targetRatePerSec;
    return new RunConfig(resolvedProfile, resolvedConcurrency, resolvedDuration, resolvedRate);
  }

  /**
   * Resolves this config and caps its virtual users at {@code ceiling}.
   *
   * @throws IllegalArgumentException if {@code ceiling < 1}
   */
  public RunConfig capConcurrency(int ceiling) {
    if (ceiling < 1) {
      throw new IllegalArgumentException("Concurrency ceiling must be at least 1: " + ceiling);
    }
    var resolved = resolve();
    if (resolved.concurrency() <= ceiling) {
      return resolved;
    }
    return new RunConfig(
        resolved.profile(), ceiling, resolved.duration(), resolved.targetRatePerSec());
  }

  public boolean throttled() {
    return targetRatePerSec != null && targetRatePerSec > 0;
  }

  /** Pause each virtual user takes between its own invocations. */
  public Duration throttleInterval() {
    if (!throttled()) {
      return Duration.ZERO;
    }
    return Duration.ofNanos((long) Math.max(1, 1_000_000_000L / targetRatePerSec));
  }
}
