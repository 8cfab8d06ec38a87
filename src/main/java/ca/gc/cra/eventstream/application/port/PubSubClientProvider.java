package ca.gc.cra.eventstream.application.port;

import ca.gc.cra.eventstream.domain.stream.Credentials;

/**
 * Service-provider interface that creates {@link PubSubClient} instances.
 *
 * <p>Implementations register under
 * {@code META-INF/services/ca.gc.cra.eventstream.application.port.PubSubClientProvider} and are
 * selected by {@link #name()}.</p>
 *
 * @since 0.1.0
 */
public interface PubSubClientProvider {
  /**
   * Returns the provider name matched against the {@code event_stream.pubsub.provider} setting.
   *
   * @return provider name
   */
  String name();

  /**
   * Creates an unauthenticated client bound to an endpoint.
   *
   * @param endpoint remote service endpoint, {@code host:port}
   * @param credentials resolved credentials used by {@link PubSubClient#authenticate()}
   * @return new client
   */
  PubSubClient create(String endpoint, Credentials credentials);
}
