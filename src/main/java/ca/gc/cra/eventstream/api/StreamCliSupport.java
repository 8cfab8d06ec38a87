package ca.gc.cra.eventstream.api;

import ca.gc.cra.eventstream.application.stream.BackoffPolicy;
import ca.gc.cra.eventstream.config.CompositionRoot;
import ca.gc.cra.eventstream.config.ConfigDefaults;
import ca.gc.cra.eventstream.config.ConfigMerger;
import ca.gc.cra.eventstream.config.StreamConfig;
import ca.gc.cra.eventstream.config.YamlConfigLoader;
import ca.gc.cra.eventstream.logging.LoggingConfigurator;
import ca.gc.cra.eventstream.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration resolution and console output shared by {@link StreamCli} and {@link PreflightCli}.
 */
final class StreamCliSupport {
  private static final Logger log = LoggerFactory.getLogger(StreamCliSupport.class);
  static final String DEFAULT_CONFIG_PATH = "config.yml";

  private StreamCliSupport() {
    // Utility class
  }

  static void enableVerboseIfRequested(CliInput input, Map<String, String> env, String command) {
    if (input.verbose() || LoggingConfigurator.verboseRequestedBy(env)) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", command);
    }
  }

  /**
   * Resolves the effective configuration: CLI over environment over YAML over defaults.
   */
  static StreamConfig resolveConfig(CliInput input, Map<String, String> env, String usage) throws CliAbort {
    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    String explicitPath = extractConfigPath(cliKv);
    Optional<Map<String, String>> yaml = loadYaml(explicitPath, usage);

    try {
      TelemetryConfigurator.configureMetrics(cliKv);
      Map<String, String> effective =
          ConfigMerger.buildEffectiveConfig(yaml, env, cliKv, ConfigDefaults.asFlatMap(), log::warn);
      StreamConfig config = StreamConfig.fromMap(effective);
      if (config.template()) {
        log.warn("Configuration is marked is_template=true; review it before running in production");
      }
      return config;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      throw new CliAbort(ExitCode.CONFIG_ERROR);
    }
  }

  static void printPlan(String heading, StreamConfig config) {
    BackoffPolicy backoff = config.backoff();
    Map<String, Object> rows = new LinkedHashMap<>();
    rows.put("Integration", config.integrationName());
    rows.put("Endpoint", config.endpoint());
    rows.put("Provider", config.provider().isEmpty() ? "<auto>" : config.provider());
    rows.put("Topics", String.join(", ", config.topics()));
    rows.put("Replay preset", config.replayPreset());
    rows.put("Replay id", config.replayId() == null ? "<none>" : config.replayId().toBase64());
    rows.put("Channel capacity", config.channelCapacity() == 0 ? "unbuffered" : config.channelCapacity());
    rows.put("Backoff", backoff.initial().toMillis() + "ms .. " + backoff.max().toMillis() + "ms x"
        + backoff.multiplier() + " (jitter " + backoff.jitter() + ")");
    rows.put("Exporter", config.exporterType()
        + (config.kafkaBootstrap() == null ? "" : " -> " + config.kafkaBootstrap() + "/" + config.kafkaTopic()));
    rows.put("Token URL", config.tokenUrl() == null ? "<unset>" : config.tokenUrl());
    rows.put("Client id", Logs.redact(config.clientId()));
    rows.put("Client secret", Logs.redact(config.clientSecret()));
    rows.put("Username", config.username() == null ? "<unset>" : config.username());
    rows.put("Password", Logs.redact(config.password()));
    CliPrinter.printTable(heading, rows);
  }

  static void closeMetrics(CompositionRoot root) {
    if (root != null && root.metrics() instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private static String extractConfigPath(Map<String, String> args) {
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  private static Optional<Map<String, String>> loadYaml(String explicitPath, String usage) throws CliAbort {
    Path path = Path.of(explicitPath == null ? DEFAULT_CONFIG_PATH : explicitPath);
    if (!Files.exists(path)) {
      if (explicitPath != null) {
        log.error("Configuration file does not exist: {}", path);
        CliPrinter.println(usage);
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
      log.debug("No {} in working directory; using defaults, environment, and CLI only", DEFAULT_CONFIG_PATH);
      return Optional.empty();
    }
    try {
      log.info("Loading configuration from {}", path);
      return YamlConfigLoader.load(path);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      throw new CliAbort(ExitCode.CONFIG_ERROR);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", path, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;
    private final transient ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(exitCode.name(), null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
