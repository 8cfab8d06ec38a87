package ca.gc.cra.eventstream.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattened default configuration; the single source of truth for optional keys.
 */
public final class ConfigDefaults {
  /** Default publish/subscribe endpoint. */
  public static final String DEFAULT_ENDPOINT = "api.pubsub.salesforce.com:7443";
  /** Topics subscribed when none are configured. */
  public static final String DEFAULT_TOPICS = "/event/LoginEventStream,/event/ApiEventStream";

  private static final Map<String, String> DEFAULTS = build();

  private ConfigDefaults() {}

  /**
   * Returns the default key/value pairs.
   *
   * @return unmodifiable map of defaults
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> build() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(StreamConfig.INTEGRATION_NAME, "event-stream-relay");
    map.put(StreamConfig.IS_TEMPLATE, "false");
    map.put(StreamConfig.TOPICS, DEFAULT_TOPICS);
    map.put(StreamConfig.REPLAY_PRESET, "LATEST");
    map.put(StreamConfig.REPLAY_ID, "");
    map.put(StreamConfig.PUBSUB_ENDPOINT, DEFAULT_ENDPOINT);
    map.put(StreamConfig.PUBSUB_PROVIDER, "");
    map.put(StreamConfig.CHANNEL_CAPACITY, "0");
    map.put(StreamConfig.BACKOFF_INITIAL_MS, "1000");
    map.put(StreamConfig.BACKOFF_MAX_MS, "60000");
    map.put(StreamConfig.BACKOFF_MULTIPLIER, "2.0");
    map.put(StreamConfig.BACKOFF_JITTER, "0.2");
    map.put(StreamConfig.SHUTDOWN_TIMEOUT_MS, "10000");
    map.put(StreamConfig.EXPORTER_TYPE, "log");
    map.put(StreamConfig.KAFKA_BOOTSTRAP, "");
    map.put(StreamConfig.KAFKA_TOPIC, "event-stream.events.v1");
    return Map.copyOf(map);
  }
}
