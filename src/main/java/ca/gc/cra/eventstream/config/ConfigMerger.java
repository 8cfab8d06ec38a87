package ca.gc.cra.eventstream.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, the environment, and CLI overrides.
 *
 * <p>Precedence is CLI &gt; environment &gt; YAML &gt; defaults. Only the {@code SF_*} credential variables
 * are read from the environment so secrets can stay out of the YAML file.</p>
 */
public final class ConfigMerger {
  /** Environment variable to configuration key mapping. */
  static final Map<String, String> ENV_KEYS = Map.of(
      "SF_GRANT_TYPE", StreamConfig.GRANT_TYPE,
      "SF_CLIENT_ID", StreamConfig.CLIENT_ID,
      "SF_CLIENT_SECRET", StreamConfig.CLIENT_SECRET,
      "SF_USERNAME", StreamConfig.USERNAME,
      "SF_PASSWORD", StreamConfig.PASSWORD,
      "SF_TOKEN_URL", StreamConfig.TOKEN_URL);

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param yaml optional YAML-derived settings
   * @param env process environment (may be {@code null})
   * @param cli CLI key/value overrides (may be {@code null})
   * @param defaults embedded defaults (may be {@code null})
   * @param warn consumer invoked when a higher-precedence source overrides YAML
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when cross-key validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> env,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);

    if (env != null) {
      for (Map.Entry<String, String> mapping : ENV_KEYS.entrySet()) {
        String value = env.get(mapping.getKey());
        if (value == null || value.isBlank()) {
          continue;
        }
        if (yamlCopy.containsKey(mapping.getValue()) && warn != null) {
          warn.accept("Environment variable " + mapping.getKey() + " overrides YAML key: " + mapping.getValue());
        }
        merged.put(mapping.getValue(), value.trim());
      }
    }

    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        String key = entry.getKey();
        if (key == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, entry.getValue());
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String exporter = trim(effective.get(StreamConfig.EXPORTER_TYPE));
    if (exporter.equalsIgnoreCase("kafka") && trim(effective.get(StreamConfig.KAFKA_BOOTSTRAP)).isEmpty()) {
      throw new IllegalArgumentException(
          StreamConfig.KAFKA_BOOTSTRAP + " is required when " + StreamConfig.EXPORTER_TYPE + "=kafka");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
