package ca.gc.cra.eventstream.api;

import ca.gc.cra.eventstream.api.StreamCliSupport.CliAbort;
import ca.gc.cra.eventstream.application.pipeline.EventsPipeline;
import ca.gc.cra.eventstream.application.port.PubSubClient;
import ca.gc.cra.eventstream.application.stream.SubscriptionOrchestrator;
import ca.gc.cra.eventstream.application.util.CancellationSignal;
import ca.gc.cra.eventstream.config.CompositionRoot;
import ca.gc.cra.eventstream.config.StreamConfig;
import ca.gc.cra.eventstream.domain.error.ConfigException;
import ca.gc.cra.eventstream.domain.error.EventStreamException;
import ca.gc.cra.eventstream.domain.stream.Credentials;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the relay until SIGINT/SIGTERM: subscribe to every configured topic and export normalized events.
 *
 * @since 0.1.0
 */
public final class StreamCli {
  private static final Logger log = LoggerFactory.getLogger(StreamCli.class);
  private static final String SUMMARY_USAGE =
      "usage: stream [config=PATH] [event_stream.KEY=VALUE ...] [metricsExporter=otlp|none] "
          + "[otelEndpoint=URL] [otelResourceAttributes=K=V,...] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      Event stream relay

      Usage:
        stream [options]

      Configuration (precedence CLI > SF_* environment > YAML > defaults):
        config=PATH                             YAML file (default ./config.yml when present)
        event_stream.topics=/event/A,/event/B   Topics to subscribe to
        event_stream.replay.preset=LATEST       EARLIEST, LATEST, or CUSTOM
        event_stream.replay.replay_id=BASE64    Required with CUSTOM, forbidden otherwise
        event_stream.pubsub.endpoint=HOST:PORT  Publish/subscribe endpoint
        event_stream.pubsub.provider=NAME       Client provider when several are registered
        event_stream.channel.capacity=0-65536   Fan-in buffer (0 = unbuffered)
        event_stream.exporter.type=log|kafka|none
        event_stream.exporter.kafka_bootstrap=HOST:PORT[,HOST:PORT]
        event_stream.exporter.kafka_topic=NAME

      Credentials (YAML event_stream.auth.* or environment):
        SF_TOKEN_URL, SF_CLIENT_ID, SF_CLIENT_SECRET, SF_USERNAME, SF_PASSWORD

      Flags:
        --dry-run    Print the resolved plan with secrets redacted and exit
        --verbose    Enable DEBUG logging (or set LOGS=1)
        --help       Show this message

      Exit codes: 0 ok, 2 invalid args, 4 config, 6 auth, 7 preflight, 5 runtime failure
      """;

  private StreamCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, System.getenv(), CompositionRoot::new, new CancellationSignal());
  }

  static ExitCode run(
      String[] args,
      Map<String, String> env,
      Function<StreamConfig, CompositionRoot> rootFactory,
      CancellationSignal cancellation) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    StreamCliSupport.enableVerboseIfRequested(input, env, "stream");

    StreamConfig config;
    try {
      config = StreamCliSupport.resolveConfig(input, env, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    if (input.hasFlag("--dry-run")) {
      StreamCliSupport.printPlan("Stream dry-run: no subscriptions will be opened.", config);
      CliPrinter.println(" Re-run without --dry-run to start streaming.");
      return ExitCode.SUCCESS;
    }

    CompositionRoot root;
    PubSubClient client;
    try {
      Credentials credentials = config.credentials();
      root = rootFactory.apply(config);
      client = root.pubSubClient(credentials);
    } catch (ConfigException ex) {
      log.error("Configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unable to create publish/subscribe client", ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    SubscriptionOrchestrator orchestrator = root.orchestrator(client, cancellation);
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      log.info("Shutdown requested; cancelling subscriptions");
      cancellation.cancel();
      awaitFinished(finished, config);
    }, "stream-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    try (EventsPipeline pipeline = root.pipeline(orchestrator)) {
      log.info("Starting {} for {} topic(s)", config.integrationName(), config.topics().size());
      orchestrator.start();
      pipeline.run(cancellation);
      log.info("Event stream relay stopped");
      return ExitCode.SUCCESS;
    } catch (EventStreamException ex) {
      ExitCode code = ExitCode.forStartupFailure(ex);
      if (code == ExitCode.AUTH_ERROR) {
        log.error("{}: {}", code.label(), ex.getMessage(), ex);
      } else {
        log.error("{}: {}", code.label(), ex.getMessage());
      }
      return code;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in event stream relay", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      orchestrator.close();
      StreamCliSupport.closeMetrics(root);
      finished.countDown();
      removeHook(hook);
    }
  }

  private static void awaitFinished(CountDownLatch finished, StreamConfig config) {
    try {
      long timeoutMillis = config.shutdownTimeout().toMillis() + 5_000L;
      if (!finished.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
        log.warn("Relay did not finish within {} ms of shutdown request", timeoutMillis);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; shutdown hook left in place");
    }
  }
}
