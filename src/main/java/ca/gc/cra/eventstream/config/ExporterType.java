package ca.gc.cra.eventstream.config;

import java.util.Locale;

/**
 * Destination for normalized events.
 *
 * @since 0.1.0
 */
public enum ExporterType {
  /** Structured log line per event. */
  LOG,
  /** JSON records published to a Kafka topic. */
  KAFKA,
  /** Events are normalized and discarded; useful for connectivity checks. */
  NONE;

  /**
   * Parses a case-insensitive exporter name.
   *
   * @param value textual exporter type; {@code null} or blank yields {@link #LOG}
   * @return exporter type
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static ExporterType fromString(String value) {
    if (value == null || value.isBlank()) {
      return LOG;
    }
    return switch (value.trim().toUpperCase(Locale.ROOT)) {
      case "LOG", "LOGGING" -> LOG;
      case "KAFKA" -> KAFKA;
      case "NONE" -> NONE;
      default -> throw new IllegalArgumentException(
          StreamConfig.EXPORTER_TYPE + " must be log, kafka, or none (was " + value.trim() + ")");
    };
  }
}
