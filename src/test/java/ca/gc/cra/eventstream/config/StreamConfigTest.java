package ca.gc.cra.eventstream.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.eventstream.application.stream.SubscriptionSettings;
import ca.gc.cra.eventstream.domain.error.ConfigException;
import ca.gc.cra.eventstream.domain.stream.Credentials;
import ca.gc.cra.eventstream.domain.stream.ReplayPreset;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StreamConfigTest {

  @Test
  void defaultsSubscribeToLoginAndApiStreams() {
    StreamConfig config = StreamConfig.defaults();

    assertEquals(List.of("/event/LoginEventStream", "/event/ApiEventStream"), config.topics());
    assertEquals(ReplayPreset.LATEST, config.replayPreset());
    assertNull(config.replayId());
    assertEquals(0, config.channelCapacity());
    assertEquals(ExporterType.LOG, config.exporterType());
    assertEquals(Duration.ofSeconds(10), config.shutdownTimeout());
    assertEquals(Credentials.PASSWORD_GRANT, config.grantType());
  }

  @Test
  void parsesCustomReplayAndBackoff() {
    StreamConfig config = StreamConfig.fromMap(Map.of(
        StreamConfig.TOPICS, "/data/AccountChangeEvent, /event/Custom_Event__e",
        StreamConfig.REPLAY_PRESET, "custom",
        StreamConfig.REPLAY_ID, "AAAAAAABAgM=",
        StreamConfig.BACKOFF_INITIAL_MS, "250",
        StreamConfig.BACKOFF_MAX_MS, "5000",
        StreamConfig.CHANNEL_CAPACITY, "128"));

    SubscriptionSettings settings = config.subscriptionSettings();
    assertEquals(List.of("/data/AccountChangeEvent", "/event/Custom_Event__e"), settings.topics());
    assertEquals(ReplayPreset.CUSTOM, settings.replayPreset());
    assertEquals("AAAAAAABAgM=", settings.replayId().toBase64());
    assertEquals(Duration.ofMillis(250), settings.backoff().initial());
    assertEquals(128, config.channelCapacity());
  }

  @Test
  void rejectsMalformedOrDuplicateTopics() {
    assertThrows(IllegalArgumentException.class,
        () -> StreamConfig.fromMap(Map.of(StreamConfig.TOPICS, "LoginEventStream")));
    assertThrows(IllegalArgumentException.class,
        () -> StreamConfig.fromMap(Map.of(StreamConfig.TOPICS, "/event/A,/event/A")));
  }

  @Test
  void rejectsUnsupportedGrantTypeAndBadTokenUrl() {
    assertThrows(IllegalArgumentException.class,
        () -> StreamConfig.fromMap(Map.of(StreamConfig.GRANT_TYPE, "client_credentials")));
    assertThrows(IllegalArgumentException.class,
        () -> StreamConfig.fromMap(Map.of(StreamConfig.TOKEN_URL, "ftp://login.example.com")));
  }

  @Test
  void kafkaExporterNormalizesBootstrap() {
    StreamConfig config = StreamConfig.fromMap(Map.of(
        StreamConfig.EXPORTER_TYPE, "kafka",
        StreamConfig.KAFKA_BOOTSTRAP, "broker-1:9092, broker-2:9092"));

    assertEquals(ExporterType.KAFKA, config.exporterType());
    assertEquals("broker-1:9092,broker-2:9092", config.kafkaBootstrap());
    assertEquals("event-stream.events.v1", config.kafkaTopic());
  }

  @Test
  void rejectsOutOfRangeNumbers() {
    assertThrows(IllegalArgumentException.class,
        () -> StreamConfig.fromMap(Map.of(StreamConfig.CHANNEL_CAPACITY, "-1")));
    assertThrows(IllegalArgumentException.class,
        () -> StreamConfig.fromMap(Map.of(StreamConfig.BACKOFF_INITIAL_MS, "9000", StreamConfig.BACKOFF_MAX_MS, "10")));
    assertThrows(IllegalArgumentException.class,
        () -> StreamConfig.fromMap(Map.of(StreamConfig.BACKOFF_JITTER, "2")));
  }

  @Test
  void credentialsRequireEverySetting() {
    ConfigException ex = assertThrows(ConfigException.class, () -> StreamConfig.defaults().credentials());
    assertTrue(ex.getMessage().contains(StreamConfig.TOKEN_URL));
  }

  @Test
  void toStringRedactsSecrets() throws Exception {
    Map<String, String> values = new HashMap<>();
    values.put(StreamConfig.TOKEN_URL, "https://login.example.com/services/oauth2/token");
    values.put(StreamConfig.CLIENT_ID, "client-id-value");
    values.put(StreamConfig.CLIENT_SECRET, "client-secret-value");
    values.put(StreamConfig.USERNAME, "svc@example.com");
    values.put(StreamConfig.PASSWORD, "hunter2");
    StreamConfig config = StreamConfig.fromMap(values);

    String text = config.toString();
    assertFalse(text.contains("client-secret-value"));
    assertFalse(text.contains("hunter2"));
    assertFalse(text.contains("client-id-value"));
    assertEquals("svc@example.com", config.credentials().username());
  }
}
