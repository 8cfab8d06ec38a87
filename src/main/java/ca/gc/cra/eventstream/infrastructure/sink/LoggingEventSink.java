package ca.gc.cra.eventstream.infrastructure.sink;

import ca.gc.cra.eventstream.application.port.EventSink;
import ca.gc.cra.eventstream.application.port.MetricsPort;
import ca.gc.cra.eventstream.domain.stream.Event;
import ca.gc.cra.eventstream.logging.Logs;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes normalized events to structured logs and counts them.
 *
 * @since 0.1.0
 */
public final class LoggingEventSink implements EventSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);
  private static final int MAX_VALUE_LENGTH = 256;

  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a logging sink.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters; defaults to {@code sink.log}
   */
  public LoggingEventSink(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? "sink.log" : metricPrefix.trim();
  }

  /**
   * Creates a logging sink with the {@code sink.log} metric prefix.
   *
   * @param metrics metrics adapter; may be {@code null}
   */
  public LoggingEventSink(MetricsPort metrics) {
    this(metrics, "sink.log");
  }

  @Override
  public void export(Event event) {
    Objects.requireNonNull(event, "event");
    metrics.increment(metricPrefix + ".exported");
    log.info("stream.event type={}, timestamp={}, payload={}",
        event.type(), event.timestamp(), formatPayload(event.payload()));
  }

  private static String formatPayload(Map<String, Object> payload) {
    StringJoiner joiner = new StringJoiner(";", "[", "]");
    for (Map.Entry<String, Object> entry : payload.entrySet()) {
      joiner.add(entry.getKey() + '=' + Logs.truncate(String.valueOf(entry.getValue()), MAX_VALUE_LENGTH));
    }
    return joiner.toString();
  }
}
