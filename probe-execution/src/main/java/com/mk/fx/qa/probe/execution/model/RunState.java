package com.mk.fx.qa.probe.execution.model;

/** Lifecycle of a load run. Transitions only move forward. */
public enum RunState {
  IDLE,
  RUNNING,
  STOPPING,
  DONE
}
