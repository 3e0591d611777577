package com.mk.fx.qa.probe.execution.verdict;

import java.util.List;

/**
 * Outcome of checking a response against an expectation.
 *
 * @param failures mismatch descriptions in check order, empty when the response passed
 */
public record Verdict(List<String> failures) {

  private static final Verdict PASSED = new Verdict(List.of());

  public Verdict {
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  public static Verdict passed() {
    return PASSED;
  }

  public boolean isPassed() {
    return failures.isEmpty();
  }

  /** All mismatches joined with {@code "; "}, or null when passed. */
  public String message() {
    return failures.isEmpty() ? null : String.join("; ", failures);
  }
}
