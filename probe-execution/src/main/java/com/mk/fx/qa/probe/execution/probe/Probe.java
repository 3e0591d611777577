package com.mk.fx.qa.probe.execution.probe;

import com.mk.fx.qa.probe.execution.model.ScenarioDescriptor;

/**
 * Performs the network call for one scenario. Supplied by the caller; the runners never build
 * requests themselves. Implementations must be safe to call from many threads at once.
 */
@FunctionalInterface
public interface Probe {
  /**
   * Invokes the target described by the scenario.
   *
   * @param descriptor the scenario to invoke
   * @return the observed response
   * @throws Exception on any transport failure; the runner records it as a failed outcome
   */
  ProbeResponse invoke(ScenarioDescriptor descriptor) throws Exception;
}
