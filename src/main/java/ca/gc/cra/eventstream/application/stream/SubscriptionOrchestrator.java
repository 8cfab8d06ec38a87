package ca.gc.cra.eventstream.application.stream;

import ca.gc.cra.eventstream.application.port.ClockPort;
import ca.gc.cra.eventstream.application.port.EventReceiver;
import ca.gc.cra.eventstream.application.port.MetricsPort;
import ca.gc.cra.eventstream.application.port.PubSubClient;
import ca.gc.cra.eventstream.application.util.CancellationSignal;
import ca.gc.cra.eventstream.domain.error.AuthException;
import ca.gc.cra.eventstream.domain.error.ConfigException;
import ca.gc.cra.eventstream.domain.error.PreflightException;
import ca.gc.cra.eventstream.domain.stream.TopicSubscription;
import ca.gc.cra.eventstream.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinates startup validation, the per-topic subscription workers, and the consumer side.
 *
 * <p>Startup runs strictly in order on the calling thread: replay policy validation, authentication,
 * user info, topic preflight. Only when every step succeeds is one {@link SubscriptionWorker} started
 * per topic. Any failure before that point leaves no worker running.</p>
 *
 * <p>{@link #receiver()} exposes the consumer loop to the downstream pipeline. {@link #close()}
 * fires the shared cancellation signal, waits for workers, and closes the protocol client.
 * Instances are single-use.</p>
 *
 * @since 0.1.0
 */
public final class SubscriptionOrchestrator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SubscriptionOrchestrator.class);

  private final PubSubClient client;
  private final SubscriptionSettings settings;
  private final FanInChannel channel;
  private final CancellationSignal cancellation;
  private final MetricsPort metrics;
  private final EventStreamReceiver receiver;
  private final List<SubscriptionWorker> workers = new ArrayList<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final UncaughtExceptionHandler workerCrashHandler;
  // guards executor publication against a concurrent close()
  private final Object lifecycleLock = new Object();

  private ExecutorService executor;

  /**
   * Wires the orchestrator.
   *
   * @param client protocol client; closed by {@link #close()}
   * @param settings topics, replay, and backoff settings
   * @param channel fan-in channel shared by workers and the receiver
   * @param cancellation signal shared by workers and the receiver
   * @param metrics metrics sink; {@code null} disables metrics
   * @param clock clock used to stamp events without {@code EventDate}
   */
  public SubscriptionOrchestrator(
      PubSubClient client,
      SubscriptionSettings settings,
      FanInChannel channel,
      CancellationSignal cancellation,
      MetricsPort metrics,
      ClockPort clock) {
    this.client = Objects.requireNonNull(client, "client");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.receiver = new EventStreamReceiver(
        channel, new EventNormalizer(Objects.requireNonNull(clock, "clock")), this.metrics);
    this.workerCrashHandler = (thread, ex) ->
        log.error("Subscription worker thread {} terminated unexpectedly", thread.getName(), ex);
  }

  /**
   * Runs every startup check without starting workers.
   *
   * @throws ConfigException when the replay configuration is inconsistent
   * @throws AuthException when authentication or the user info lookup fails
   * @throws PreflightException when any topic is not subscribable
   */
  public void preflight() throws ConfigException, AuthException, PreflightException {
    ReplayPolicyValidator.validate(settings.replayPreset(), settings.replayId());

    log.info("Populating auth token...");
    client.authenticate();

    log.info("Populating user info...");
    client.fetchUserInfo();

    new TopicPreflightValidator(client, metrics).validate(settings.topics());
  }

  /**
   * Validates startup conditions and starts one worker per topic.
   *
   * @throws ConfigException when the replay configuration is inconsistent
   * @throws AuthException when authentication or the user info lookup fails
   * @throws PreflightException when any topic is not subscribable
   * @throws IllegalStateException when called twice, or when {@link #close()} runs before workers start
   */
  public void start() throws ConfigException, AuthException, PreflightException {
    if (closed.get() || !started.compareAndSet(false, true)) {
      throw new IllegalStateException("Subscription orchestrator already started or closed");
    }
    preflight();

    List<String> topics = settings.topics();
    synchronized (lifecycleLock) {
      if (closed.get()) {
        throw new IllegalStateException("Subscription orchestrator closed during startup");
      }
      if (cancellation.isCancelled()) {
        log.info("Cancelled during startup; no subscription workers started");
        return;
      }
      ExecutorService pool = ExecutorFactories.newSubscriptionPool(
          topics.size(), "stream-worker", workerCrashHandler);
      executor = pool;
      for (String topic : topics) {
        TopicSubscription subscription =
            new TopicSubscription(topic, settings.replayPreset(), settings.replayId());
        SubscriptionWorker worker = new SubscriptionWorker(
            client, subscription, channel, settings.backoff(), cancellation, metrics);
        synchronized (workers) {
          workers.add(worker);
        }
        pool.execute(worker);
      }
    }
    log.info("Started {} subscription worker(s) with channel capacity {}", topics.size(), channel.capacity());
  }

  /**
   * Returns the consumer loop to register with the downstream pipeline.
   *
   * @return receiver draining the fan-in channel
   */
  public EventReceiver receiver() {
    return receiver;
  }

  /**
   * Returns the cancellation signal shared by every worker and the receiver.
   *
   * @return shared signal
   */
  public CancellationSignal cancellation() {
    return cancellation;
  }

  /**
   * Returns a snapshot of per-topic subscription state.
   *
   * @return one entry per started worker
   */
  public List<TopicSubscription> subscriptions() {
    synchronized (workers) {
      return workers.stream().map(SubscriptionWorker::subscription).toList();
    }
  }

  /**
   * Cancels every worker, waits up to the configured shutdown timeout, and closes the client.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    cancellation.cancel();
    ExecutorService pool;
    synchronized (lifecycleLock) {
      pool = executor;
    }
    if (pool != null) {
      pool.shutdown();
      try {
        long timeoutMillis = settings.shutdownTimeout().toMillis();
        if (!pool.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
          log.warn("Subscription workers did not stop within {} ms; interrupting", timeoutMillis);
          pool.shutdownNow();
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        pool.shutdownNow();
      }
    }
    try {
      client.close();
      log.info("Protocol client closed");
    } catch (RuntimeException ex) {
      log.error("Failed to close protocol client", ex);
    }
  }
}
