package ca.gc.cra.eventstream.application.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

  @Test
  void noFailuresMeansNoDelay() {
    assertEquals(0L, BackoffPolicy.defaults().delayMillis(0, () -> 0.9));
  }

  @Test
  void growsGeometricallyAndCaps() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100), Duration.ofMillis(1_000), 2.0, 0.0);

    assertEquals(100L, policy.delayMillis(1, () -> 0.3));
    assertEquals(200L, policy.delayMillis(2, () -> 0.3));
    assertEquals(400L, policy.delayMillis(3, () -> 0.3));
    assertEquals(800L, policy.delayMillis(4, () -> 0.3));
    assertEquals(1_000L, policy.delayMillis(5, () -> 0.3));
    assertEquals(1_000L, policy.delayMillis(60, () -> 0.3));
  }

  @Test
  void jitterStaysWithinBand() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(1_000), Duration.ofMillis(60_000), 2.0, 0.2);

    assertEquals(800L, policy.delayMillis(1, () -> 0.0));
    assertEquals(1_000L, policy.delayMillis(1, () -> 0.5));
    long high = policy.delayMillis(1, () -> 0.999_999);
    assertTrue(high > 1_190L && high <= 1_200L, "upper jitter bound was " + high);
  }

  @Test
  void jitterNeverExceedsCap() {
    BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(1_000), Duration.ofMillis(1_000), 2.0, 1.0);
    assertEquals(1_000L, policy.delayMillis(3, () -> 1.0));
  }

  @Test
  void rejectsInvalidParameters() {
    assertThrows(IllegalArgumentException.class,
        () -> new BackoffPolicy(Duration.ofMillis(500), Duration.ofMillis(100), 2.0, 0.1));
    assertThrows(IllegalArgumentException.class,
        () -> new BackoffPolicy(Duration.ofMillis(100), Duration.ofMillis(500), 0.5, 0.1));
    assertThrows(IllegalArgumentException.class,
        () -> new BackoffPolicy(Duration.ofMillis(100), Duration.ofMillis(500), 2.0, 1.5));
    assertThrows(IllegalArgumentException.class,
        () -> new BackoffPolicy(Duration.ZERO, Duration.ofMillis(500), 2.0, 0.1));
  }
}
