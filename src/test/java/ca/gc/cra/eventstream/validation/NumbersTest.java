package ca.gc.cra.eventstream.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("capacity", 10, 0, 64));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("capacity", -1, 0, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("capacity", 65, 0, 64));
  }

  @Test
  void parseLongAndDoubleReportTheSettingName() {
    assertEquals(250L, Numbers.parseLong("initial_ms", " 250 ", 1, 1_000));
    assertEquals(0.2d, Numbers.parseDouble("jitter", "0.2", 0.0, 1.0));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseLong("initial_ms", "soon", 1, 1_000));
    assertEquals("initial_ms must be an integer (was soon)", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("jitter", "NaN", 0.0, 1.0));
  }
}
