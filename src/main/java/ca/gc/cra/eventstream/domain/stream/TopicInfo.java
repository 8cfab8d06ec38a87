package ca.gc.cra.eventstream.domain.stream;

import java.util.Objects;

/**
 * Topic metadata returned by the protocol client during preflight.
 *
 * @param topicName fully qualified topic name, e.g. {@code /event/LoginEventStream}
 * @param canSubscribe whether the authenticated user may subscribe to the topic
 * @since 0.1.0
 */
public record TopicInfo(String topicName, boolean canSubscribe) {

  /**
   * Validates the topic name.
   */
  public TopicInfo {
    Objects.requireNonNull(topicName, "topicName");
  }
}
