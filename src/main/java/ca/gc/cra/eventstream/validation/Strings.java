package ca.gc.cra.eventstream.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings read from configuration files, the environment,
 * and the CLI.
 * <p><strong>Why:</strong> Rejects blank credentials and malformed topic names before the relay opens any
 * remote connection.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs or metrics; failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern KAFKA_TOPIC_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final Pattern STREAM_TOPIC_PATTERN =
      Pattern.compile("^/(event|data)/[A-Za-z0-9_]+(__[A-Za-z0-9]+)?$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name.
   *
   * @param name logical parameter name included in exception messages
   * @param topic candidate topic; must be non-null
   * @return trimmed topic matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the topic contains unsupported characters
   */
  public static String sanitizeKafkaTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (!KAFKA_TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates a publish/subscribe channel name such as {@code /event/LoginEventStream}.
   *
   * @param name logical parameter name included in exception messages
   * @param topic candidate channel name
   * @return trimmed channel name
   * @throws IllegalArgumentException if the name is not {@code /event/NAME} or {@code /data/NAME}
   */
  public static String requireStreamTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (!STREAM_TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must look like /event/Name or /data/Name (was " + sanitized + ")"));
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value is too long or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Returns whether the value is {@code null} or blank.
   *
   * @param value candidate text
   * @return {@code true} when nothing but whitespace is present
   */
  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
