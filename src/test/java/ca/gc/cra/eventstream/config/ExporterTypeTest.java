package ca.gc.cra.eventstream.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ExporterTypeTest {

  @Test
  void parsesKnownValues() {
    assertEquals(ExporterType.LOG, ExporterType.fromString(null));
    assertEquals(ExporterType.LOG, ExporterType.fromString("logging"));
    assertEquals(ExporterType.KAFKA, ExporterType.fromString(" Kafka "));
    assertEquals(ExporterType.NONE, ExporterType.fromString("none"));
  }

  @Test
  void rejectsUnknownValues() {
    assertThrows(IllegalArgumentException.class, () -> ExporterType.fromString("http"));
  }
}
