package ca.gc.cra.eventstream.config;

import ca.gc.cra.eventstream.adapter.kafka.KafkaEventSink;
import ca.gc.cra.eventstream.application.pipeline.EventsPipeline;
import ca.gc.cra.eventstream.application.port.ClockPort;
import ca.gc.cra.eventstream.application.port.EventSink;
import ca.gc.cra.eventstream.application.port.MetricsPort;
import ca.gc.cra.eventstream.application.port.PubSubClient;
import ca.gc.cra.eventstream.application.port.PubSubClientProvider;
import ca.gc.cra.eventstream.application.stream.FanInChannel;
import ca.gc.cra.eventstream.application.stream.SubscriptionOrchestrator;
import ca.gc.cra.eventstream.application.util.CancellationSignal;
import ca.gc.cra.eventstream.domain.error.ConfigException;
import ca.gc.cra.eventstream.domain.stream.Credentials;
import ca.gc.cra.eventstream.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.eventstream.infrastructure.pubsub.PubSubClientProviders;
import ca.gc.cra.eventstream.infrastructure.sink.LoggingEventSink;
import ca.gc.cra.eventstream.infrastructure.time.SystemClockAdapter;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Central composition root that wires the relay from a {@link StreamConfig}.
 * <p><strong>Role:</strong> Translates configuration into the protocol client, the orchestrator, and the
 * downstream pipeline with its exporters.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances and
 * are meant for the startup thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  /** Pipeline identity used in logs. */
  public static final String PIPELINE_ID = "event-stream-pipeline";

  private final StreamConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Function<String, PubSubClientProvider> providerLookup;

  /**
   * Creates a composition root with OpenTelemetry metrics and the system clock.
   *
   * @param config resolved configuration
   */
  public CompositionRoot(StreamConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), new SystemClockAdapter(), null);
  }

  /**
   * Creates a composition root with explicit collaborators.
   *
   * @param config resolved configuration
   * @param metrics metrics adapter
   * @param clock clock used by the normalizer
   * @param providerLookup provider lookup by name; {@code null} uses {@link PubSubClientProviders}
   */
  public CompositionRoot(
      StreamConfig config,
      MetricsPort metrics,
      ClockPort clock,
      Function<String, PubSubClientProvider> providerLookup) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.providerLookup = providerLookup;
  }

  /**
   * Returns the configuration this root was built from.
   *
   * @return configuration
   */
  public StreamConfig config() {
    return config;
  }

  /**
   * Returns the shared metrics adapter.
   *
   * @return metrics adapter
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Creates the protocol client through the configured provider.
   *
   * @param credentials resolved credentials
   * @return unauthenticated client
   * @throws ConfigException when no matching provider is registered
   */
  public PubSubClient pubSubClient(Credentials credentials) throws ConfigException {
    PubSubClientProvider provider = providerLookup == null
        ? PubSubClientProviders.select(config.provider())
        : providerLookup.apply(config.provider());
    if (provider == null) {
      throw new ConfigException("No PubSubClientProvider available for '" + config.provider() + "'");
    }
    return provider.create(config.endpoint(), credentials);
  }

  /**
   * Creates the orchestrator for the configured topics.
   *
   * @param client protocol client; the orchestrator closes it
   * @param cancellation shared cancellation signal
   * @return orchestrator ready to {@link SubscriptionOrchestrator#start()}
   */
  public SubscriptionOrchestrator orchestrator(PubSubClient client, CancellationSignal cancellation) {
    return new SubscriptionOrchestrator(
        client,
        config.subscriptionSettings(),
        FanInChannel.withCapacity(config.channelCapacity()),
        cancellation,
        metrics,
        clock);
  }

  /**
   * Creates the configured exporter.
   *
   * @return exporters in dispatch order
   */
  public List<EventSink> exporters() {
    return switch (config.exporterType()) {
      case LOG -> List.of(new LoggingEventSink(metrics));
      case KAFKA -> List.of(new KafkaEventSink(config.kafkaBootstrap(), config.kafkaTopic(), metrics));
      case NONE -> List.of(EventSink.NO_OP);
    };
  }

  /**
   * Creates the downstream pipeline bound to the orchestrator's receiver.
   *
   * @param orchestrator started or not-yet-started orchestrator
   * @return pipeline host
   */
  public EventsPipeline pipeline(SubscriptionOrchestrator orchestrator) {
    return new EventsPipeline(PIPELINE_ID, orchestrator.receiver(), exporters(), metrics);
  }
}
