package com.mk.fx.qa.probe.execution.utils;

import java.time.Duration;

public final class LoadUtils {

  private LoadUtils() {
    // Utility class, no instantiation
  }

  /**
   * Parses {@code 500ms}, {@code 30s}, {@code 5m}, {@code 1h}, or a bare number of seconds.
   * Blank input yields {@link Duration#ZERO}.
   *
   * @throws IllegalArgumentException on an unknown unit or a malformed amount
   */
  public static Duration parseDuration(String value) {
    if (value == null || value.isBlank()) {
      return Duration.ZERO;
    }
    String trimmed = value.trim().toLowerCase();
    try {
      if (trimmed.endsWith("ms")) {
        long ms = Long.parseLong(trimmed.substring(0, trimmed.length() - 2).trim());
        return Duration.ofMillis(ms);
      }
      char unit = trimmed.charAt(trimmed.length() - 1);
      if (Character.isDigit(unit)) {
        return Duration.ofSeconds(Long.parseLong(trimmed));
      }
      long amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim());
      return switch (unit) {
        case 's' -> Duration.ofSeconds(amount);
        case 'm' -> Duration.ofMinutes(amount);
        case 'h' -> Duration.ofHours(amount);
        default -> throw new IllegalArgumentException("Unrecognised duration unit in " + value);
      };
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Malformed duration: " + value, ex);
    }
  }
}
