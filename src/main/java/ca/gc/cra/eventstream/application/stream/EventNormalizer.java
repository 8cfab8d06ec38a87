package ca.gc.cra.eventstream.application.stream;

import ca.gc.cra.eventstream.application.port.ClockPort;
import ca.gc.cra.eventstream.domain.error.DecodeException;
import ca.gc.cra.eventstream.domain.stream.Event;
import ca.gc.cra.eventstream.domain.stream.RawEvent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed decode step that turns a {@link RawEvent} into a normalized {@link Event}.
 *
 * <p>The {@code eventType} field is required and must be a non-blank string. {@code EventDate} is
 * optional epoch milliseconds; when absent or {@code null} the event is stamped with the current
 * time. Both fields are removed from the emitted payload.</p>
 *
 * @since 0.1.0
 */
public final class EventNormalizer {
  /** Field carrying the event type. */
  public static final String EVENT_TYPE_FIELD = "eventType";
  /** Field carrying the event time as epoch milliseconds. */
  public static final String EVENT_DATE_FIELD = "EventDate";

  private final ClockPort clock;

  /**
   * Creates a normalizer that reads the current time from {@code clock}.
   *
   * @param clock wall-clock source for events without {@code EventDate}
   */
  public EventNormalizer(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Normalizes one raw event.
   *
   * @param raw event as decoded by the protocol client
   * @return normalized event
   * @throws DecodeException when {@code eventType} is missing or either metadata field is mistyped
   */
  public Event normalize(RawEvent raw) throws DecodeException {
    Objects.requireNonNull(raw, "raw");
    Map<String, Object> payload = new LinkedHashMap<>(raw.fields());

    Object type = payload.remove(EVENT_TYPE_FIELD);
    if (type == null) {
      throw new DecodeException("Event from topic " + raw.topic() + " is missing " + EVENT_TYPE_FIELD);
    }
    if (!(type instanceof CharSequence text) || text.toString().isBlank()) {
      throw new DecodeException("Event from topic " + raw.topic() + " has a non-string or blank "
          + EVENT_TYPE_FIELD + " (" + type.getClass().getSimpleName() + ')');
    }

    Object date = payload.remove(EVENT_DATE_FIELD);
    Instant timestamp = date == null
        ? Instant.ofEpochMilli(clock.nowMillis())
        : toInstant(raw.topic(), date);
    return new Event(text.toString(), payload, timestamp);
  }

  private static Instant toInstant(String topic, Object value) throws DecodeException {
    try {
      if (value instanceof Instant instant) {
        return instant;
      }
      if (value instanceof Long || value instanceof Integer || value instanceof Short) {
        return Instant.ofEpochMilli(((Number) value).longValue());
      }
      if (value instanceof BigInteger big) {
        return Instant.ofEpochMilli(big.longValueExact());
      }
      if (value instanceof BigDecimal decimal) {
        return Instant.ofEpochMilli(decimal.longValueExact());
      }
      if (value instanceof Double || value instanceof Float) {
        double millis = ((Number) value).doubleValue();
        if (Double.isNaN(millis) || Double.isInfinite(millis) || millis != Math.rint(millis)) {
          throw new DecodeException("Event from topic " + topic + " has a non-integral " + EVENT_DATE_FIELD);
        }
        return Instant.ofEpochMilli((long) millis);
      }
      if (value instanceof CharSequence text) {
        return Instant.ofEpochMilli(Long.parseLong(text.toString().trim()));
      }
    } catch (NumberFormatException | ArithmeticException | DateTimeException ex) {
      throw new DecodeException("Event from topic " + topic + " has an unreadable " + EVENT_DATE_FIELD
          + ": " + ex.getMessage(), ex);
    }
    throw new DecodeException("Event from topic " + topic + " has an unsupported " + EVENT_DATE_FIELD
        + " type " + value.getClass().getSimpleName());
  }
}
