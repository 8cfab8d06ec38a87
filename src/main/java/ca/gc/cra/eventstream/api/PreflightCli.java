package ca.gc.cra.eventstream.api;

import ca.gc.cra.eventstream.api.StreamCliSupport.CliAbort;
import ca.gc.cra.eventstream.application.port.PubSubClient;
import ca.gc.cra.eventstream.application.stream.SubscriptionOrchestrator;
import ca.gc.cra.eventstream.application.util.CancellationSignal;
import ca.gc.cra.eventstream.config.CompositionRoot;
import ca.gc.cra.eventstream.config.StreamConfig;
import ca.gc.cra.eventstream.domain.error.EventStreamException;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that the relay could start: credentials, replay policy, authentication, and every topic.
 *
 * <p>Opens no subscription; exits with the same codes {@link StreamCli} would use at startup.</p>
 *
 * @since 0.1.0
 */
public final class PreflightCli {
  private static final Logger log = LoggerFactory.getLogger(PreflightCli.class);
  private static final String SUMMARY_USAGE =
      "usage: preflight [config=PATH] [event_stream.KEY=VALUE ...] [--verbose]";
  private static final String HELP_TEXT = """
      Event stream relay preflight

      Usage:
        preflight [options]

      Resolves credentials, validates the replay settings, authenticates, and confirms each configured
      topic exists and is subscribable. Accepts the same configuration keys as the stream command.

      Flags:
        --verbose    Enable DEBUG logging (or set LOGS=1)
        --help       Show this message
      """;

  private PreflightCli() {}

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
    return run(args, System.getenv(), CompositionRoot::new);
  }

  static ExitCode run(
      String[] args, Map<String, String> env, Function<StreamConfig, CompositionRoot> rootFactory) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    StreamCliSupport.enableVerboseIfRequested(input, env, "preflight");

    StreamConfig config;
    try {
      config = StreamCliSupport.resolveConfig(input, env, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    CompositionRoot root = null;
    try {
      root = rootFactory.apply(config);
      PubSubClient client = root.pubSubClient(config.credentials());
      try (SubscriptionOrchestrator orchestrator = root.orchestrator(client, new CancellationSignal())) {
        orchestrator.preflight();
      }
      StreamCliSupport.printPlan("Preflight passed for " + config.topics().size() + " topic(s).", config);
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
      log.error("Unexpected runtime failure during preflight", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      StreamCliSupport.closeMetrics(root);
    }
  }
}
