package ca.gc.cra.eventstream.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.eventstream.testing.RecordingMetricsPort;
import ca.gc.cra.eventstream.testing.ScriptedPubSubClient;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PreflightCliTest {
  private static final String TOPICS_ARG = "event_stream.topics=/event/LoginEventStream,/event/ApiEventStream";

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void passingPreflightOpensNoSubscription() {
    ScriptedPubSubClient client = new ScriptedPubSubClient()
        .withTopic("/event/LoginEventStream", true)
        .withTopic("/event/ApiEventStream", true);
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    ExitCode code = PreflightCli.run(new String[] {TOPICS_ARG}, CliTestSupport.CREDENTIAL_ENV,
        CliTestSupport.rootWith(client, metrics));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Preflight passed for 2 topic(s)."));
    assertFalse(buffer.toString().contains("hunter2"));
    assertEquals(List.of("/event/LoginEventStream", "/event/ApiEventStream"), client.topicLookups());
    assertTrue(client.subscribeCalls().isEmpty());
    assertTrue(client.isClosed());
    assertTrue(metrics.isClosed());
  }

  @Test
  void unknownTopicReturnsPreflightError() {
    ScriptedPubSubClient client = new ScriptedPubSubClient().withTopic("/event/LoginEventStream", true);

    ExitCode code = PreflightCli.run(new String[] {TOPICS_ARG}, CliTestSupport.CREDENTIAL_ENV,
        CliTestSupport.rootWith(client, new RecordingMetricsPort()));

    assertEquals(ExitCode.PREFLIGHT_ERROR, code);
  }

  @Test
  void authenticationFailureReturnsAuthError() {
    ScriptedPubSubClient client = new ScriptedPubSubClient().failingAuthentication("expired password");
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    ExitCode code = PreflightCli.run(new String[] {TOPICS_ARG}, CliTestSupport.CREDENTIAL_ENV,
        CliTestSupport.rootWith(client, metrics));

    assertEquals(ExitCode.AUTH_ERROR, code);
    assertTrue(metrics.isClosed());
  }
}
