package ca.gc.cra.eventstream.logging;

import java.nio.charset.StandardCharsets;

/**
 * Logging hygiene helpers for credentials and event payload excerpts.
 *
 * <p>Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String REDACTED = "[REDACTED]";
  private static final String UNSET = "<unset>";

  private Logs() {}

  /**
   * Cuts a payload value to at most {@code maxBytes} UTF-8 bytes, never splitting a character.
   *
   * <p>A cut value carries a {@code "... (truncated, kept of total bytes)"} suffix, where {@code kept} is
   * the byte budget rather than the bytes actually retained.</p>
   *
   * @param value value to cut; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the value unchanged when it fits, otherwise its longest fitting prefix plus the suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return "<null>";
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int total = value.getBytes(StandardCharsets.UTF_8).length;
    if (total <= maxBytes) {
      return value;
    }
    int used = 0;
    int end = 0;
    while (end < value.length()) {
      int cp = value.codePointAt(end);
      int width = utf8Width(cp);
      if (used + width > maxBytes) {
        break;
      }
      used += width;
      end += Character.charCount(cp);
    }
    return value.substring(0, end) + "... (truncated, " + maxBytes + " of " + total + " bytes)";
  }

  /**
   * Hides a secret while still telling operators whether it was configured.
   *
   * @param value sensitive value; never echoed
   * @return {@code [REDACTED]} when present, {@code <unset>} when {@code null} or blank
   */
  public static String redact(String value) {
    return value == null || value.isBlank() ? UNSET : REDACTED;
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
