package com.dronetrack.tracker.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class UaTypeTest {

  @Test
  void resolve_acceptsIntegerCodes() {
    assertEquals(Optional.of(UaType.HELICOPTER_OR_MULTIROTOR), UaType.resolve(2));
    assertEquals(Optional.of(UaType.OTHER), UaType.resolve("15"));
  }

  @Test
  void resolve_acceptsNamesIgnoringCase() {
    assertEquals(Optional.of(UaType.HELICOPTER_OR_MULTIROTOR), UaType.resolve("helicopter or multirotor"));
    assertEquals(Optional.of(UaType.GLIDER), UaType.resolve("GLIDER"));
  }

  @Test
  void resolve_isEmptyOutsideTable() {
    assertTrue(UaType.resolve(16).isEmpty());
    assertTrue(UaType.resolve(-1).isEmpty());
    assertTrue(UaType.resolve("Spaceship").isEmpty());
    assertTrue(UaType.resolve(null).isEmpty());
    assertTrue(UaType.resolve(true).isEmpty());
  }

  @Test
  void table_coversAllSixteenCodes() {
    assertEquals(16, UaType.values().length);
    for (int code = 0; code <= 15; code++) {
      assertEquals(code, UaType.fromCode(code).orElseThrow().code());
    }
  }
}
