package ca.gc.cra.eventstream.domain.stream;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decoded but untyped event payload as produced by the protocol client.
 *
 * <p>Field values are whatever the client's decoder produced (strings, boxed numbers, nested
 * maps, {@code null}). The field map is copied and exposed read-only; the normalizer works on its
 * own copy when stripping metadata.</p>
 *
 * @param topic topic the event was received on
 * @param fields field name to value mapping; {@code null} values are permitted
 * @since 0.1.0
 */
public record RawEvent(String topic, Map<String, Object> fields) {

  /**
   * Copies the field map and validates the topic.
   */
  public RawEvent {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(fields, "fields");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }
}
