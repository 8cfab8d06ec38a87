package ca.gc.cra.eventstream.application.stream;

import ca.gc.cra.eventstream.application.port.MetricsPort;
import ca.gc.cra.eventstream.application.port.PubSubClient;
import ca.gc.cra.eventstream.domain.error.PreflightException;
import ca.gc.cra.eventstream.domain.error.TopicLookupException;
import ca.gc.cra.eventstream.domain.stream.TopicInfo;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All-or-nothing gate confirming that every configured topic is subscribable.
 *
 * <p>A single failed lookup or a single {@code canSubscribe == false} aborts startup for every
 * topic; partial startup with a reduced topic set is not supported.</p>
 *
 * @since 0.1.0
 */
public final class TopicPreflightValidator {
  private static final Logger log = LoggerFactory.getLogger(TopicPreflightValidator.class);

  private final PubSubClient client;
  private final MetricsPort metrics;

  /**
   * Creates a validator bound to an authenticated client.
   *
   * @param client authenticated protocol client
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public TopicPreflightValidator(PubSubClient client, MetricsPort metrics) {
    this.client = Objects.requireNonNull(client, "client");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Checks each topic in order, stopping at the first failure.
   *
   * @param topics configured topic names; must not be empty
   * @throws PreflightException when any topic fails its lookup or is not subscribable
   */
  public void validate(List<String> topics) throws PreflightException {
    Objects.requireNonNull(topics, "topics");
    if (topics.isEmpty()) {
      throw new PreflightException("No topics configured");
    }
    for (String topic : topics) {
      log.info("Checking topic {}", topic);
      metrics.increment("preflight.topics.checked");
      TopicInfo info;
      try {
        info = client.getTopicInfo(topic);
      } catch (TopicLookupException ex) {
        metrics.increment("preflight.topics.failed");
        throw new PreflightException("Could not fetch topic " + topic + ": " + ex.getMessage(), ex);
      }
      if (info == null || !info.canSubscribe()) {
        metrics.increment("preflight.topics.failed");
        throw new PreflightException(
            "This user is not allowed to subscribe to the following topic: " + topic);
      }
    }
    log.info("Preflight passed for {} topic(s)", topics.size());
  }
}
