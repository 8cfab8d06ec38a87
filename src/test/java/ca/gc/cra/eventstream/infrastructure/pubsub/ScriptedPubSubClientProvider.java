package ca.gc.cra.eventstream.infrastructure.pubsub;

import ca.gc.cra.eventstream.application.port.PubSubClient;
import ca.gc.cra.eventstream.application.port.PubSubClientProvider;
import ca.gc.cra.eventstream.domain.stream.Credentials;
import ca.gc.cra.eventstream.testing.ScriptedPubSubClient;

/** Provider registered through {@code META-INF/services} for class path discovery tests. */
public final class ScriptedPubSubClientProvider implements PubSubClientProvider {
  @Override
  public String name() {
    return "scripted";
  }

  @Override
  public PubSubClient create(String endpoint, Credentials credentials) {
    return new ScriptedPubSubClient().withTopic("/event/LoginEventStream", true);
  }
}
