package ca.gc.cra.eventstream.application.stream;

import ca.gc.cra.eventstream.domain.stream.Checkpoint;
import ca.gc.cra.eventstream.domain.stream.ReplayPreset;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings consumed by {@link SubscriptionOrchestrator}.
 *
 * @param topics topics to subscribe to, one worker each
 * @param replayPreset global replay preset
 * @param replayId global initial replay id; {@code null} unless the preset is CUSTOM
 * @param backoff reconnect backoff policy
 * @param shutdownTimeout how long {@link SubscriptionOrchestrator#close()} waits for workers
 * @since 0.1.0
 */
public record SubscriptionSettings(
    List<String> topics,
    ReplayPreset replayPreset,
    Checkpoint replayId,
    BackoffPolicy backoff,
    Duration shutdownTimeout) {

  /**
   * Copies the topic list and fills defaults.
   */
  public SubscriptionSettings {
    topics = List.copyOf(Objects.requireNonNull(topics, "topics"));
    Objects.requireNonNull(replayPreset, "replayPreset");
    backoff = Objects.requireNonNullElse(backoff, BackoffPolicy.defaults());
    shutdownTimeout = Objects.requireNonNullElse(shutdownTimeout, Duration.ofSeconds(10));
  }
}
