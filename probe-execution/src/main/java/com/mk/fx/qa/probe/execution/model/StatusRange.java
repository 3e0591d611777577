package com.mk.fx.qa.probe.execution.model;

/**
 * Inclusive range of acceptable status codes.
 *
 * @param min lowest accepted status
 * @param max highest accepted status
 */
public record StatusRange(int min, int max) {

  public StatusRange {
    if (min > max) {
      throw new IllegalArgumentException(
          "Status range min " + min + " must not exceed max " + max);
    }
  }

  public boolean contains(int status) {
    return status >= min && status <= max;
  }
}
