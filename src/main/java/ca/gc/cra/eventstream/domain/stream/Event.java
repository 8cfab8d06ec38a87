package ca.gc.cra.eventstream.domain.stream;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized event handed to the downstream pipeline.
 *
 * <p><strong>Thread-safety:</strong> Immutable; ownership passes to the pipeline once emitted.</p>
 *
 * @param type event type extracted from the {@code eventType} field
 * @param payload remaining payload fields with routing metadata removed
 * @param timestamp event time in UTC
 * @since 0.1.0
 */
public record Event(String type, Map<String, Object> payload, Instant timestamp) {

  /**
   * Validates required fields and freezes the payload.
   */
  public Event {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(timestamp, "timestamp");
    payload = payload == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
