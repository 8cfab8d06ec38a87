package ca.gc.cra.eventstream.domain.stream;

import java.util.Objects;

/**
 * A raw event paired with the replay position the remote service assigned to it.
 *
 * @param event decoded event payload
 * @param checkpoint position to resume from after {@code event}
 * @since 0.1.0
 */
public record ReceivedEvent(RawEvent event, Checkpoint checkpoint) {

  /**
   * Validates that both parts are present.
   */
  public ReceivedEvent {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(checkpoint, "checkpoint");
  }
}
