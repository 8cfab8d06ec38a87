package ca.gc.cra.eventstream.domain.stream;

import java.util.Locale;

/**
 * Selects where a topic subscription resumes in the remote event history.
 *
 * @since 0.1.0
 */
public enum ReplayPreset {
  /** Resume from the earliest event still retained by the remote service. */
  EARLIEST,
  /** Resume from the tip of the stream; only new events are delivered. */
  LATEST,
  /** Resume immediately after an explicit {@link Checkpoint}. */
  CUSTOM;

  /**
   * Parses a preset name case-insensitively.
   *
   * @param raw preset name such as {@code latest}; must not be blank
   * @return matching preset
   * @throws IllegalArgumentException when the value is blank or unknown
   */
  public static ReplayPreset parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("replay preset must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (ReplayPreset preset : values()) {
      if (preset.name().equals(normalized)) {
        return preset;
      }
    }
    throw new IllegalArgumentException(
        "replay preset must be one of EARLIEST, LATEST, CUSTOM (was " + raw.trim() + ")");
  }
}
