package ca.gc.cra.eventstream.application.stream;

import ca.gc.cra.eventstream.application.port.EventStream;
import ca.gc.cra.eventstream.application.port.MetricsPort;
import ca.gc.cra.eventstream.application.port.PubSubClient;
import ca.gc.cra.eventstream.application.util.CancellationSignal;
import ca.gc.cra.eventstream.domain.error.StreamException;
import ca.gc.cra.eventstream.domain.stream.Checkpoint;
import ca.gc.cra.eventstream.domain.stream.ReceivedEvent;
import ca.gc.cra.eventstream.domain.stream.ReplayPreset;
import ca.gc.cra.eventstream.domain.stream.SubscriptionState;
import ca.gc.cra.eventstream.domain.stream.TopicSubscription;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Resumable subscribe loop for one topic.
 *
 * <p>The worker cycles {@code SUBSCRIBING -> STREAMING -> RECONNECTING -> SUBSCRIBING} until the
 * shared {@link CancellationSignal} fires. Each subscribe attempt resumes from the last checkpoint
 * (forcing {@link ReplayPreset#CUSTOM}) once one exists. Segment failures are logged and retried with
 * {@link BackoffPolicy}; they never escape {@link #run()}.</p>
 *
 * <p>Every suspension point races the cancellation signal: the backoff wait and channel send observe
 * it directly, and an open segment is closed by a cancellation callback so a blocked receive returns.
 * Each segment is closed exactly once, whichever of cancellation or segment end gets there first.</p>
 *
 * @since 0.1.0
 */
public final class SubscriptionWorker implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(SubscriptionWorker.class);

  private final PubSubClient client;
  private final TopicSubscription subscription;
  private final FanInChannel channel;
  private final BackoffPolicy backoff;
  private final CancellationSignal cancellation;
  private final MetricsPort metrics;
  private final DoubleSupplier random;

  /**
   * Creates a worker using {@link ThreadLocalRandom} for backoff jitter.
   *
   * @param client protocol client shared by all workers
   * @param subscription state owned by this worker
   * @param channel fan-in channel shared by all workers
   * @param backoff reconnect backoff policy
   * @param cancellation shared cancellation signal
   * @param metrics metrics sink
   */
  public SubscriptionWorker(
      PubSubClient client,
      TopicSubscription subscription,
      FanInChannel channel,
      BackoffPolicy backoff,
      CancellationSignal cancellation,
      MetricsPort metrics) {
    this(client, subscription, channel, backoff, cancellation, metrics,
        () -> ThreadLocalRandom.current().nextDouble());
  }

  SubscriptionWorker(
      PubSubClient client,
      TopicSubscription subscription,
      FanInChannel channel,
      BackoffPolicy backoff,
      CancellationSignal cancellation,
      MetricsPort metrics,
      DoubleSupplier random) {
    this.client = Objects.requireNonNull(client, "client");
    this.subscription = Objects.requireNonNull(subscription, "subscription");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.random = Objects.requireNonNull(random, "random");
  }

  /**
   * Runs the subscribe loop until cancelled or interrupted.
   */
  @Override
  public void run() {
    String topic = subscription.topicName();
    MDC.put("topic", topic);
    int consecutiveFailures = 0;
    try {
      while (!cancellation.isCancelled()) {
        long delivered = streamSegment();
        if (cancellation.isCancelled()) {
          break;
        }
        subscription.transition(SubscriptionState.RECONNECTING);
        consecutiveFailures = delivered > 0 ? 0 : consecutiveFailures + 1;
        long delay = backoff.delayMillis(consecutiveFailures, random);
        if (delay > 0) {
          log.info("Resubscribing to topic {} in {} ms after {} unproductive segment(s)",
              topic, delay, consecutiveFailures);
          metrics.observe("stream.backoff.millis", delay);
          if (cancellation.await(delay, TimeUnit.MILLISECONDS)) {
            break;
          }
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.info("Subscription worker for topic {} interrupted", topic);
    } finally {
      subscription.transition(SubscriptionState.STOPPED);
      log.info("Subscription worker stopped: {}", subscription);
      MDC.remove("topic");
    }
  }

  /**
   * Returns the subscription state owned by this worker.
   *
   * @return live subscription state
   */
  public TopicSubscription subscription() {
    return subscription;
  }

  private long streamSegment() throws InterruptedException {
    subscription.transition(SubscriptionState.SUBSCRIBING);
    long attempt = subscription.recordAttempt();
    ReplayPreset preset = subscription.effectivePreset();
    Checkpoint checkpoint = subscription.checkpoint();
    log.info("Subscribing to topic {} (attempt {}, preset {})", subscription.topicName(), attempt, preset);
    metrics.increment("stream.subscribe.attempts");

    EventStream stream = open(preset, checkpoint);
    if (stream == null) {
      return 0L;
    }
    long delivered = 0L;
    AtomicBoolean segmentClosed = new AtomicBoolean();
    Runnable closeSegment = () -> {
      if (segmentClosed.compareAndSet(false, true)) {
        stream.close();
      }
    };
    try (CancellationSignal.Registration ignored = cancellation.onCancel(closeSegment)) {
      subscription.transition(SubscriptionState.STREAMING);
      while (!cancellation.isCancelled()) {
        Optional<ReceivedEvent> next = stream.next();
        if (next.isEmpty()) {
          log.info("Stream for topic {} ended after {} event(s)", subscription.topicName(), delivered);
          metrics.increment("stream.segment.completed");
          break;
        }
        ReceivedEvent received = next.get();
        if (!channel.send(received.event(), cancellation)) {
          break;
        }
        subscription.advance(received.checkpoint());
        delivered++;
        metrics.increment("stream.events.received");
      }
    } catch (StreamException ex) {
      if (!cancellation.isCancelled()) {
        log.warn("Error occurred while streaming topic {} after {} event(s): {}",
            subscription.topicName(), delivered, ex.getMessage());
        metrics.increment("stream.segment.errors");
      }
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while streaming topic {}", subscription.topicName(), ex);
      metrics.increment("stream.segment.errors");
    } finally {
      closeSegment.run();
    }
    return delivered;
  }

  private EventStream open(ReplayPreset preset, Checkpoint checkpoint) {
    try {
      return client.subscribe(subscription.topicName(), preset, checkpoint);
    } catch (StreamException ex) {
      log.warn("Error occurred while subscribing to topic {}: {}", subscription.topicName(), ex.getMessage());
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while subscribing to topic {}", subscription.topicName(), ex);
    }
    metrics.increment("stream.segment.errors");
    return null;
  }
}
