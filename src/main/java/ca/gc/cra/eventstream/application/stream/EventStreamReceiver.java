package ca.gc.cra.eventstream.application.stream;

import ca.gc.cra.eventstream.application.port.EventReceiver;
import ca.gc.cra.eventstream.application.port.EventSink;
import ca.gc.cra.eventstream.application.port.MetricsPort;
import ca.gc.cra.eventstream.application.util.CancellationSignal;
import ca.gc.cra.eventstream.domain.error.DecodeException;
import ca.gc.cra.eventstream.domain.stream.Event;
import ca.gc.cra.eventstream.domain.stream.RawEvent;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Single-threaded consumer of the {@link FanInChannel}.
 *
 * <p>Each received event is normalized and handed to the sink. Events that fail to decode are logged
 * and dropped; the loop keeps running. Once the cancellation signal fires the loop returns without
 * delivering anything further, including an event it may already have taken from the channel.</p>
 *
 * @since 0.1.0
 */
public final class EventStreamReceiver implements EventReceiver {
  private static final Logger log = LoggerFactory.getLogger(EventStreamReceiver.class);

  /** Receiver identity reported to the pipeline. */
  public static final String RECEIVER_ID = "event-stream-receiver";

  private final FanInChannel channel;
  private final EventNormalizer normalizer;
  private final MetricsPort metrics;

  /**
   * Creates a receiver draining {@code channel}.
   *
   * @param channel shared fan-in channel
   * @param normalizer decode step applied to each event
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public EventStreamReceiver(FanInChannel channel, EventNormalizer normalizer, MetricsPort metrics) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public String id() {
    return RECEIVER_ID;
  }

  @Override
  public void pollEvents(CancellationSignal cancellation, EventSink sink) {
    Objects.requireNonNull(cancellation, "cancellation");
    Objects.requireNonNull(sink, "sink");
    MDC.put("pipeline", RECEIVER_ID);
    long emitted = 0;
    long rejected = 0;
    try {
      while (true) {
        Optional<RawEvent> next = channel.receive(cancellation);
        if (next.isEmpty() || cancellation.isCancelled()) {
          break;
        }
        RawEvent raw = next.get();
        Event event;
        try {
          event = normalizer.normalize(raw);
        } catch (DecodeException ex) {
          rejected++;
          metrics.increment("normalizer.events.rejected");
          log.warn("Rejected event from topic {}: {}", raw.topic(), ex.getMessage());
          continue;
        }
        log.debug("Send new {} event from topic {}", event.type(), raw.topic());
        sink.export(event);
        emitted++;
        metrics.increment("normalizer.events.emitted");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.info("Receiver {} interrupted", RECEIVER_ID);
    } finally {
      log.info("Receiver {} stopped after emitting {} and rejecting {} event(s)", RECEIVER_ID, emitted, rejected);
      MDC.remove("pipeline");
    }
  }
}
