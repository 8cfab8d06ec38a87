package ca.gc.cra.eventstream.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("short", Logs.truncate("short", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void truncateCutsOnUtf8Boundary() {
    String truncated = Logs.truncate("ééé", 3);
    assertEquals("é... (truncated, 3 of 6 bytes)", truncated);
  }

  @Test
  void redactHidesPresenceOnly() {
    assertEquals("[REDACTED]", Logs.redact("secret"));
    assertEquals("<unset>", Logs.redact(" "));
    assertEquals("<unset>", Logs.redact(null));
  }

  @Test
  void verboseRequestedByLogsEnvironmentFlag() {
    assertTrue(LoggingConfigurator.verboseRequestedBy(Map.of("LOGS", "1")));
    assertFalse(LoggingConfigurator.verboseRequestedBy(Map.of("LOGS", "0")));
    assertFalse(LoggingConfigurator.verboseRequestedBy(null));
  }
}
