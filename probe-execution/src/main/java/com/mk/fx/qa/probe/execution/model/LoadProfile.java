package com.mk.fx.qa.probe.execution.model;

import java.time.Duration;
import java.util.Arrays;

/**
 * Named load shapes. Each is a preset of concurrency and duration over the same duration-bound
 * run; explicit values in a {@link RunConfig} take precedence.
 */
public enum LoadProfile {
  /** Moderate steady traffic. */
  LOAD(10, Duration.ofSeconds(30)),
  /** Concurrency beyond the expected capacity of the target. */
  STRESS(50, Duration.ofSeconds(60)),
  /** A short burst of very high concurrency. */
  SPIKE(100, Duration.ofSeconds(10)),
  /** Moderate concurrency held for a long time. */
  SOAK(10, Duration.ofMinutes(10));

  private final int defaultConcurrency;
  private final Duration defaultDuration;

  LoadProfile(int defaultConcurrency, Duration defaultDuration) {
    this.defaultConcurrency = defaultConcurrency;
    this.defaultDuration = defaultDuration;
  }

  public int defaultConcurrency() {
    return defaultConcurrency;
  }

  public Duration defaultDuration() {
    return defaultDuration;
  }

  /** Resolves a profile name case-insensitively; blank resolves to {@link #LOAD}. */
  public static LoadProfile fromValue(String value) {
    if (value == null || value.isBlank()) {
      return LOAD;
    }
    return Arrays.stream(values())
        .filter(profile -> profile.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unsupported load profile: "
                        + value
                        + ". Allowed: "
                        + Arrays.toString(values())));
  }
}
