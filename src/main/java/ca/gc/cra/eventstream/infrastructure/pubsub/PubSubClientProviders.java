package ca.gc.cra.eventstream.infrastructure.pubsub;

import ca.gc.cra.eventstream.application.port.PubSubClientProvider;
import ca.gc.cra.eventstream.domain.error.ConfigException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers {@link PubSubClientProvider} implementations registered with {@link ServiceLoader}.
 *
 * <p>A blank requested name selects the only registered provider; with several registered, the
 * name must be given explicitly.</p>
 *
 * @since 0.1.0
 */
public final class PubSubClientProviders {
  private static final Logger log = LoggerFactory.getLogger(PubSubClientProviders.class);

  private PubSubClientProviders() {}

  /**
   * Selects a provider from the context class path.
   *
   * @param name provider name; blank to auto-select
   * @return matching provider
   * @throws ConfigException when no provider matches
   */
  public static PubSubClientProvider select(String name) throws ConfigException {
    return select(name, ServiceLoader.load(PubSubClientProvider.class));
  }

  /**
   * Selects a provider among explicit candidates.
   *
   * @param name provider name (case-insensitive); blank to auto-select
   * @param candidates available providers
   * @return matching provider
   * @throws ConfigException when none is registered, the name is unknown, or the choice is ambiguous
   */
  public static PubSubClientProvider select(String name, Iterable<PubSubClientProvider> candidates)
      throws ConfigException {
    Objects.requireNonNull(candidates, "candidates");
    List<PubSubClientProvider> available = new ArrayList<>();
    for (PubSubClientProvider provider : candidates) {
      available.add(provider);
    }
    if (available.isEmpty()) {
      throw new ConfigException("No PubSubClientProvider is registered on the class path");
    }
    List<String> names = available.stream().map(PubSubClientProvider::name).toList();
    if (name == null || name.isBlank()) {
      if (available.size() > 1) {
        throw new ConfigException(
            "Several PubSubClientProviders are registered " + names + "; set event_stream.pubsub.provider");
      }
      PubSubClientProvider only = available.get(0);
      log.info("Using publish/subscribe client provider {}", only.name());
      return only;
    }
    String wanted = name.trim().toLowerCase(Locale.ROOT);
    for (PubSubClientProvider provider : available) {
      if (provider.name().toLowerCase(Locale.ROOT).equals(wanted)) {
        log.info("Using publish/subscribe client provider {}", provider.name());
        return provider;
      }
    }
    throw new ConfigException("Unknown PubSubClientProvider '" + name.trim() + "'; registered: " + names);
  }
}
