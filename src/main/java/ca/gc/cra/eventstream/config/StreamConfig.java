package ca.gc.cra.eventstream.config;

import ca.gc.cra.eventstream.application.stream.BackoffPolicy;
import ca.gc.cra.eventstream.application.stream.CredentialContext;
import ca.gc.cra.eventstream.application.stream.SubscriptionSettings;
import ca.gc.cra.eventstream.domain.error.ConfigException;
import ca.gc.cra.eventstream.domain.stream.Checkpoint;
import ca.gc.cra.eventstream.domain.stream.Credentials;
import ca.gc.cra.eventstream.domain.stream.ReplayPreset;
import ca.gc.cra.eventstream.logging.Logs;
import ca.gc.cra.eventstream.validation.Net;
import ca.gc.cra.eventstream.validation.Numbers;
import ca.gc.cra.eventstream.validation.Strings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable relay configuration resolved from defaults, YAML, environment, and CLI.
 * <p><strong>Why:</strong> Replaces process-global settings with one value passed through the
 * {@link CompositionRoot}; nothing reads configuration after startup.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * <p>Credential fields are kept raw here and resolved by {@link #credentials()}, so a missing secret
 * is reported together with every other missing credential key.</p>
 *
 * @param integrationName name used in logs and the dry-run plan
 * @param template whether the file is still a template ({@code is_template})
 * @param topics distinct topic names, in configured order
 * @param replayPreset global replay preset
 * @param replayId initial replay id; {@code null} unless configured
 * @param endpoint publish/subscribe endpoint {@code host:port}
 * @param provider client provider name; blank selects the only registered provider
 * @param channelCapacity fan-in buffer size; {@code 0} is an unbuffered rendezvous
 * @param backoff reconnect backoff policy
 * @param shutdownTimeout how long shutdown waits for workers
 * @param exporterType event destination
 * @param kafkaBootstrap Kafka bootstrap servers; {@code null} unless the exporter is Kafka
 * @param kafkaTopic Kafka topic for exported events
 * @param grantType OAuth grant type; only {@code password} is supported
 * @param tokenUrl OAuth token endpoint (raw)
 * @param clientId client id (raw)
 * @param clientSecret client secret (raw)
 * @param username user name (raw)
 * @param password password (raw)
 * @since 0.1.0
 */
public record StreamConfig(
    String integrationName,
    boolean template,
    List<String> topics,
    ReplayPreset replayPreset,
    Checkpoint replayId,
    String endpoint,
    String provider,
    int channelCapacity,
    BackoffPolicy backoff,
    Duration shutdownTimeout,
    ExporterType exporterType,
    String kafkaBootstrap,
    String kafkaTopic,
    String grantType,
    String tokenUrl,
    String clientId,
    String clientSecret,
    String username,
    String password) {

  public static final String VERSION = "version";
  public static final String IS_TEMPLATE = "is_template";
  public static final String INTEGRATION_NAME = "event_stream.integration_name";
  public static final String GRANT_TYPE = "event_stream.auth.grant_type";
  public static final String TOKEN_URL = "event_stream.auth.token_url";
  public static final String CLIENT_ID = "event_stream.auth.user_pass.client_id";
  public static final String CLIENT_SECRET = "event_stream.auth.user_pass.client_secret";
  public static final String USERNAME = "event_stream.auth.user_pass.username";
  public static final String PASSWORD = "event_stream.auth.user_pass.password";
  public static final String TOPICS = "event_stream.topics";
  public static final String REPLAY_PRESET = "event_stream.replay.preset";
  public static final String REPLAY_ID = "event_stream.replay.replay_id";
  public static final String PUBSUB_ENDPOINT = "event_stream.pubsub.endpoint";
  public static final String PUBSUB_PROVIDER = "event_stream.pubsub.provider";
  public static final String CHANNEL_CAPACITY = "event_stream.channel.capacity";
  public static final String BACKOFF_INITIAL_MS = "event_stream.backoff.initial_ms";
  public static final String BACKOFF_MAX_MS = "event_stream.backoff.max_ms";
  public static final String BACKOFF_MULTIPLIER = "event_stream.backoff.multiplier";
  public static final String BACKOFF_JITTER = "event_stream.backoff.jitter";
  public static final String SHUTDOWN_TIMEOUT_MS = "event_stream.shutdown_timeout_ms";
  public static final String EXPORTER_TYPE = "event_stream.exporter.type";
  public static final String KAFKA_BOOTSTRAP = "event_stream.exporter.kafka_bootstrap";
  public static final String KAFKA_TOPIC = "event_stream.exporter.kafka_topic";

  private static final int MAX_CHANNEL_CAPACITY = 65_536;
  private static final int MAX_TOPICS = 64;

  /**
   * Copies the topic list.
   */
  public StreamConfig {
    topics = List.copyOf(topics);
    Objects.requireNonNull(replayPreset, "replayPreset");
    Objects.requireNonNull(backoff, "backoff");
    Objects.requireNonNull(exporterType, "exporterType");
  }

  /**
   * Returns the configuration produced by the embedded defaults alone.
   *
   * @return default configuration, without credentials
   */
  public static StreamConfig defaults() {
    return fromMap(ConfigDefaults.asFlatMap());
  }

  /**
   * Builds a configuration from flattened key/value pairs.
   *
   * @param args merged configuration; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException naming the offending key when a value is invalid
   */
  public static StreamConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Map<String, String> defaults = ConfigDefaults.asFlatMap();

    String integrationName = Strings.requireNonBlank(INTEGRATION_NAME, value(args, defaults, INTEGRATION_NAME));
    boolean template = Boolean.parseBoolean(value(args, defaults, IS_TEMPLATE).trim());
    List<String> topics = parseTopics(value(args, defaults, TOPICS));
    ReplayPreset preset = ReplayPreset.parse(value(args, defaults, REPLAY_PRESET));
    String rawReplayId = value(args, defaults, REPLAY_ID);
    Checkpoint replayId = Strings.isBlank(rawReplayId) ? null : Checkpoint.fromBase64(rawReplayId);
    String endpoint = Net.validateHostPort(value(args, defaults, PUBSUB_ENDPOINT));
    String provider = value(args, defaults, PUBSUB_PROVIDER).trim();
    int channelCapacity = (int) Numbers.parseLong(
        CHANNEL_CAPACITY, value(args, defaults, CHANNEL_CAPACITY), 0, MAX_CHANNEL_CAPACITY);

    long initialMs = Numbers.parseLong(BACKOFF_INITIAL_MS, value(args, defaults, BACKOFF_INITIAL_MS), 1, 3_600_000);
    long maxMs = Numbers.parseLong(BACKOFF_MAX_MS, value(args, defaults, BACKOFF_MAX_MS), 1, 3_600_000);
    if (maxMs < initialMs) {
      throw new IllegalArgumentException(BACKOFF_MAX_MS + " must be >= " + BACKOFF_INITIAL_MS);
    }
    BackoffPolicy backoff = new BackoffPolicy(
        Duration.ofMillis(initialMs),
        Duration.ofMillis(maxMs),
        Numbers.parseDouble(BACKOFF_MULTIPLIER, value(args, defaults, BACKOFF_MULTIPLIER), 1.0, 10.0),
        Numbers.parseDouble(BACKOFF_JITTER, value(args, defaults, BACKOFF_JITTER), 0.0, 1.0));
    Duration shutdownTimeout = Duration.ofMillis(Numbers.parseLong(
        SHUTDOWN_TIMEOUT_MS, value(args, defaults, SHUTDOWN_TIMEOUT_MS), 0, 600_000));

    ExporterType exporterType = ExporterType.fromString(value(args, defaults, EXPORTER_TYPE));
    String kafkaBootstrap = null;
    String kafkaTopic = Strings.sanitizeKafkaTopic(KAFKA_TOPIC, value(args, defaults, KAFKA_TOPIC));
    if (exporterType == ExporterType.KAFKA) {
      String rawBootstrap = value(args, defaults, KAFKA_BOOTSTRAP);
      if (Strings.isBlank(rawBootstrap)) {
        throw new IllegalArgumentException(KAFKA_BOOTSTRAP + " is required when " + EXPORTER_TYPE + "=kafka");
      }
      kafkaBootstrap = Net.validateHostPortList(rawBootstrap);
    }

    String grantType = optional(args, GRANT_TYPE);
    if (grantType != null && !Credentials.PASSWORD_GRANT.equals(grantType)) {
      throw new IllegalArgumentException(GRANT_TYPE + " must be '" + Credentials.PASSWORD_GRANT + "'");
    }
    String tokenUrl = optional(args, TOKEN_URL);
    if (tokenUrl != null) {
      tokenUrl = Net.validateHttpUrl(TOKEN_URL, tokenUrl);
    }

    return new StreamConfig(
        integrationName,
        template,
        topics,
        preset,
        replayId,
        endpoint,
        provider,
        channelCapacity,
        backoff,
        shutdownTimeout,
        exporterType,
        kafkaBootstrap,
        kafkaTopic,
        grantType == null ? Credentials.PASSWORD_GRANT : grantType,
        tokenUrl,
        optional(args, CLIENT_ID),
        optional(args, CLIENT_SECRET),
        optional(args, USERNAME),
        optional(args, PASSWORD));
  }

  /**
   * Resolves the credentials once.
   *
   * @return immutable credentials
   * @throws ConfigException naming every missing credential key
   */
  public Credentials credentials() throws ConfigException {
    return CredentialContext.resolve(tokenUrl, clientId, clientSecret, username, password).credentials();
  }

  /**
   * Projects the settings consumed by the subscription orchestrator.
   *
   * @return orchestrator settings
   */
  public SubscriptionSettings subscriptionSettings() {
    return new SubscriptionSettings(topics, replayPreset, replayId, backoff, shutdownTimeout);
  }

  @Override
  public String toString() {
    return "StreamConfig[integrationName=" + integrationName
        + ", topics=" + topics
        + ", replayPreset=" + replayPreset
        + ", replayId=" + (replayId == null ? "<none>" : replayId.toBase64())
        + ", endpoint=" + endpoint
        + ", provider=" + (provider.isEmpty() ? "<auto>" : provider)
        + ", channelCapacity=" + channelCapacity
        + ", backoff=" + backoff
        + ", exporterType=" + exporterType
        + ", tokenUrl=" + tokenUrl
        + ", clientId=" + Logs.redact(clientId)
        + ", clientSecret=" + Logs.redact(clientSecret)
        + ", username=" + username
        + ", password=" + Logs.redact(password) + ']';
  }

  private static List<String> parseTopics(String raw) {
    if (Strings.isBlank(raw)) {
      throw new IllegalArgumentException(TOPICS + " must list at least one topic");
    }
    Set<String> unique = new LinkedHashSet<>();
    for (String token : raw.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      String topic = Strings.requireStreamTopic(TOPICS, token);
      if (!unique.add(topic)) {
        throw new IllegalArgumentException(TOPICS + " contains duplicate topic " + topic);
      }
    }
    if (unique.isEmpty()) {
      throw new IllegalArgumentException(TOPICS + " must list at least one topic");
    }
    Numbers.requireRange(TOPICS + " count", unique.size(), 1, MAX_TOPICS);
    return new ArrayList<>(unique);
  }

  private static String value(Map<String, String> args, Map<String, String> defaults, String key) {
    String value = args.get(key);
    if (value == null || value.isBlank()) {
      return defaults.getOrDefault(key, "");
    }
    return value;
  }

  private static String optional(Map<String, String> args, String key) {
    String value = args.get(key);
    return Strings.isBlank(value) ? null : value.trim();
  }
}
