package ca.gc.cra.eventstream.application.pipeline;

import ca.gc.cra.eventstream.application.port.EventReceiver;
import ca.gc.cra.eventstream.application.port.EventSink;
import ca.gc.cra.eventstream.application.port.MetricsPort;
import ca.gc.cra.eventstream.application.util.CancellationSignal;
import ca.gc.cra.eventstream.domain.stream.Event;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal in-process host that drives one {@link EventReceiver} and fans its events out to exporters.
 *
 * <p>A failing exporter is logged and counted; the remaining exporters still receive the event and the
 * receiver keeps running. {@link #run} blocks the calling thread until the cancellation signal fires.</p>
 *
 * @since 0.1.0
 */
public final class EventsPipeline implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(EventsPipeline.class);

  private final String id;
  private final EventReceiver receiver;
  private final List<EventSink> exporters;
  private final MetricsPort metrics;

  /**
   * Creates a pipeline.
   *
   * @param id pipeline identity for logs
   * @param receiver event source
   * @param exporters destinations; at least one
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public EventsPipeline(String id, EventReceiver receiver, List<EventSink> exporters, MetricsPort metrics) {
    this.id = Objects.requireNonNull(id, "id");
    this.receiver = Objects.requireNonNull(receiver, "receiver");
    this.exporters = List.copyOf(Objects.requireNonNull(exporters, "exporters"));
    if (this.exporters.isEmpty()) {
      throw new IllegalArgumentException("at least one exporter is required");
    }
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Polls the receiver until cancelled.
   *
   * @param cancellation signal ending the run
   */
  public void run(CancellationSignal cancellation) {
    log.info("Pipeline {} polling receiver {} into {} exporter(s)", id, receiver.id(), exporters.size());
    receiver.pollEvents(cancellation, this::dispatch);
    log.info("Pipeline {} stopped", id);
  }

  private void dispatch(Event event) {
    for (EventSink exporter : exporters) {
      try {
        exporter.export(event);
      } catch (RuntimeException ex) {
        metrics.increment("pipeline.export.failed");
        log.error("Exporter {} failed for {} event", exporter.getClass().getSimpleName(), event.type(), ex);
      }
    }
  }

  /**
   * Closes every exporter, logging failures.
   */
  @Override
  public void close() {
    for (EventSink exporter : exporters) {
      try {
        exporter.close();
      } catch (Exception ex) {
        log.error("Failed to close exporter {}", exporter.getClass().getSimpleName(), ex);
      }
    }
  }
}
