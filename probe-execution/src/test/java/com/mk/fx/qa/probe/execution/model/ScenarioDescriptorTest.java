package com.mk.fx.qa.probe.execution.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ScenarioDescriptorTest {

  @Test
  void defaults_applyForMissingFields() {
    var scenario =
        new ScenarioDescriptor("sec-001", null, "security", null, " post ", null, null, null, null);

    assertEquals("POST", scenario.method());
    assertEquals("", scenario.target());
    assertTrue(scenario.headers().isEmpty());
    assertEquals(Expectation.none(), scenario.expectation());
    assertEquals("sec-001", scenario.displayName());
  }

  @Test
  void idIsRequired() {
    assertThrows(
        NullPointerException.class,
        () -> new ScenarioDescriptor(null, "n", null, null, "GET", "/", null, null, null));
  }

  @Test
  void statusRange_rejectsInvertedBounds() {
    assertThrows(IllegalArgumentException.class, () -> new StatusRange(500, 400));
    assertTrue(new StatusRange(200, 299).contains(204));
  }
}
