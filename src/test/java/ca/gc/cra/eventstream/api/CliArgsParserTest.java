package ca.gc.cra.eventstream.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "event_stream.topics=/event/LoginEventStream", "metricsExporter=none"});
    assertEquals("/event/LoginEventStream", map.get("event_stream.topics"));
    assertEquals("none", map.get("metricsExporter"));
  }

  @Test
  void keepsEqualsSignsInValues() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=team=relay"});
    assertEquals("team=relay", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsArgumentsWithoutValue() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=v"}));
  }

  @Test
  void nullArgumentsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
