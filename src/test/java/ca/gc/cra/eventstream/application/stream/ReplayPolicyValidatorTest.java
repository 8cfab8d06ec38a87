package ca.gc.cra.eventstream.application.stream;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.eventstream.domain.error.ConfigException;
import ca.gc.cra.eventstream.domain.stream.Checkpoint;
import ca.gc.cra.eventstream.domain.stream.ReplayPreset;
import org.junit.jupiter.api.Test;

class ReplayPolicyValidatorTest {
  private static final Checkpoint REPLAY_ID = Checkpoint.of(new byte[] {0, 0, 0, 0, 0, 1, 2, 3});

  @Test
  void customRequiresReplayId() {
    ConfigException ex = assertThrows(ConfigException.class,
        () -> ReplayPolicyValidator.validate(ReplayPreset.CUSTOM, null));
    assertTrue(ex.getMessage().contains("must be populated"));
  }

  @Test
  void customWithReplayIdIsAccepted() {
    assertDoesNotThrow(() -> ReplayPolicyValidator.validate(ReplayPreset.CUSTOM, REPLAY_ID));
  }

  @Test
  void latestAndEarliestRejectReplayId() {
    assertThrows(ConfigException.class, () -> ReplayPolicyValidator.validate(ReplayPreset.LATEST, REPLAY_ID));
    ConfigException ex = assertThrows(ConfigException.class,
        () -> ReplayPolicyValidator.validate(ReplayPreset.EARLIEST, REPLAY_ID));
    assertTrue(ex.getMessage().contains("EARLIEST"));
  }

  @Test
  void latestAndEarliestWithoutReplayIdAreAccepted() {
    assertDoesNotThrow(() -> ReplayPolicyValidator.validate(ReplayPreset.LATEST, null));
    assertDoesNotThrow(() -> ReplayPolicyValidator.validate(ReplayPreset.EARLIEST, null));
  }
}
