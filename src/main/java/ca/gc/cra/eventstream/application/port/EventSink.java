package ca.gc.cra.eventstream.application.port;

import ca.gc.cra.eventstream.domain.stream.Event;

/**
 * <strong>What:</strong> Outbound port receiving normalized events for export.
 * <p><strong>Why:</strong> Keeps the relay decoupled from delivery transports (logs, Kafka, test collectors).</p>
 * <p><strong>Thread-safety:</strong> Called from the single consumer thread; implementations need not be
 * thread-safe unless shared across pipelines.</p>
 *
 * @since 0.1.0
 */
public interface EventSink extends AutoCloseable {
  /**
   * Exports a normalized event.
   *
   * @param event event to export; never {@code null}
   */
  void export(Event event);

  /**
   * Sink that discards every event.
   */
  EventSink NO_OP = new EventSink() {
    @Override public void export(Event event) {}

    @Override public void close() {}
  };

  @Override
  default void close() {}
}
