package ca.gc.cra.eventstream.application.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.eventstream.domain.error.DecodeException;
import ca.gc.cra.eventstream.domain.stream.Event;
import ca.gc.cra.eventstream.domain.stream.RawEvent;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventNormalizerTest {
  private static final long NOW = 1_710_000_000_123L;
  private final EventNormalizer normalizer = new EventNormalizer(() -> NOW);

  @Test
  void liftsTypeAndEventDateOutOfPayload() throws Exception {
    Event event = normalizer.normalize(raw(Map.of("eventType", "LoginEvent", "EventDate", 1_700_000_000_000L, "x", 1)));

    assertEquals("LoginEvent", event.type());
    assertEquals(Instant.parse("2023-11-14T22:13:20Z"), event.timestamp());
    assertEquals(Map.of("x", 1), event.payload());
  }

  @Test
  void missingEventDateUsesClock() throws Exception {
    Event event = normalizer.normalize(raw(Map.of("eventType", "ApiEvent", "Query", "SELECT Id FROM Account")));

    assertEquals(Instant.ofEpochMilli(NOW), event.timestamp());
    assertEquals(Map.of("Query", "SELECT Id FROM Account"), event.payload());
  }

  @Test
  void numericTextAndIntegralDoublesAreAccepted() throws Exception {
    assertEquals(Instant.ofEpochMilli(42L),
        normalizer.normalize(raw(Map.of("eventType", "A", "EventDate", "42"))).timestamp());
    assertEquals(Instant.ofEpochMilli(42L),
        normalizer.normalize(raw(Map.of("eventType", "A", "EventDate", 42.0d))).timestamp());
  }

  @Test
  void missingEventTypeIsRejected() {
    DecodeException ex = assertThrows(DecodeException.class,
        () -> normalizer.normalize(raw(Map.of("EventDate", 1L, "x", 1))));
    assertTrue(ex.getMessage().contains("eventType"));
  }

  @Test
  void blankOrNonStringEventTypeIsRejected() {
    assertThrows(DecodeException.class, () -> normalizer.normalize(raw(Map.of("eventType", "  "))));
    assertThrows(DecodeException.class, () -> normalizer.normalize(raw(Map.of("eventType", 7))));
  }

  @Test
  void unreadableEventDateIsRejected() {
    assertThrows(DecodeException.class,
        () -> normalizer.normalize(raw(Map.of("eventType", "A", "EventDate", "yesterday"))));
    assertThrows(DecodeException.class,
        () -> normalizer.normalize(raw(Map.of("eventType", "A", "EventDate", 1.5d))));
    assertThrows(DecodeException.class,
        () -> normalizer.normalize(raw(Map.of("eventType", "A", "EventDate", new Object()))));
  }

  @Test
  void preservesPayloadOrder() throws Exception {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("b", 2);
    fields.put("eventType", "A");
    fields.put("a", 1);

    Event event = normalizer.normalize(raw(fields));

    assertEquals("[b, a]", event.payload().keySet().toString());
  }

  private static RawEvent raw(Map<String, Object> fields) {
    return new RawEvent("/event/LoginEventStream", fields);
  }
}
