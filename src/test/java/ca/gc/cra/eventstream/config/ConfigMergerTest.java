package ca.gc.cra.eventstream.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void precedenceIsCliThenEnvironmentThenYamlThenDefaults() {
    Map<String, String> yaml = Map.of(
        StreamConfig.CLIENT_ID, "yaml-client",
        StreamConfig.USERNAME, "yaml-user",
        StreamConfig.REPLAY_PRESET, "EARLIEST");
    Map<String, String> env = Map.of("SF_CLIENT_ID", "env-client", "SF_USERNAME", "env-user");
    Map<String, String> cli = Map.of(StreamConfig.USERNAME, "cli-user");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(yaml), env, cli, ConfigDefaults.asFlatMap(), warnings::add);

    assertEquals("cli-user", merged.get(StreamConfig.USERNAME));
    assertEquals("env-client", merged.get(StreamConfig.CLIENT_ID));
    assertEquals("EARLIEST", merged.get(StreamConfig.REPLAY_PRESET));
    assertEquals(ConfigDefaults.DEFAULT_ENDPOINT, merged.get(StreamConfig.PUBSUB_ENDPOINT));
    assertTrue(warnings.stream().anyMatch(w -> w.contains("SF_CLIENT_ID")));
    assertTrue(warnings.stream().anyMatch(w -> w.contains("CLI overrides YAML")));
  }

  @Test
  void blankEnvironmentValuesAreIgnored() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of(StreamConfig.PASSWORD, "from-yaml")),
        Map.of("SF_PASSWORD", "  "),
        Map.of(),
        ConfigDefaults.asFlatMap(),
        null);

    assertEquals("from-yaml", merged.get(StreamConfig.PASSWORD));
  }

  @Test
  void kafkaExporterRequiresBootstrap() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        Optional.empty(),
        Map.of(),
        Map.of(StreamConfig.EXPORTER_TYPE, "kafka"),
        ConfigDefaults.asFlatMap(),
        null));
  }
}
