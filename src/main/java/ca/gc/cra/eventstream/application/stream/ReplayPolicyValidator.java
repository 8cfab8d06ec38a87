package ca.gc.cra.eventstream.application.stream;

import ca.gc.cra.eventstream.domain.error.ConfigException;
import ca.gc.cra.eventstream.domain.stream.Checkpoint;
import ca.gc.cra.eventstream.domain.stream.ReplayPreset;
import java.util.Objects;

/**
 * Checks the global replay configuration before any network call is made.
 *
 * <p>Exactly one of these must hold: the preset is {@link ReplayPreset#CUSTOM} and a replay id is
 * configured, or the preset is EARLIEST/LATEST and no replay id is configured.</p>
 *
 * @since 0.1.0
 */
public final class ReplayPolicyValidator {

  private ReplayPolicyValidator() {}

  /**
   * Validates the preset/replay id combination.
   *
   * @param preset globally configured preset
   * @param replayId globally configured replay id; may be {@code null}
   * @throws ConfigException when the combination is inconsistent
   */
  public static void validate(ReplayPreset preset, Checkpoint replayId) throws ConfigException {
    Objects.requireNonNull(preset, "preset");
    if (preset == ReplayPreset.CUSTOM && replayId == null) {
      throw new ConfigException(
          "event_stream.replay.replay_id must be populated when the replay preset is CUSTOM");
    }
    if (preset != ReplayPreset.CUSTOM && replayId != null) {
      throw new ConfigException(
          "event_stream.replay.replay_id must not be populated when the replay preset is " + preset);
    }
  }
}
