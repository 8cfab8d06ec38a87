package ca.gc.cra.eventstream.application.stream;

import ca.gc.cra.eventstream.domain.error.ConfigException;
import ca.gc.cra.eventstream.domain.stream.Credentials;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves configured user/password authentication settings into immutable {@link Credentials}.
 *
 * <p>Resolution happens once on the startup thread, before any worker exists. The resulting context
 * is handed by reference to the client provider; nothing mutates it afterwards, so concurrent reads
 * need no locking.</p>
 *
 * @since 0.1.0
 */
public final class CredentialContext {
  private static final Logger log = LoggerFactory.getLogger(CredentialContext.class);

  private final Credentials credentials;

  private CredentialContext(Credentials credentials) {
    this.credentials = credentials;
  }

  /**
   * Resolves the password-grant credentials.
   *
   * @param tokenUrl OAuth token endpoint
   * @param clientId connected-app client id
   * @param clientSecret connected-app client secret
   * @param username service account user
   * @param password service account password
   * @return resolved context
   * @throws ConfigException naming every missing field when any is {@code null} or blank
   */
  public static CredentialContext resolve(
      String tokenUrl, String clientId, String clientSecret, String username, String password)
      throws ConfigException {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("event_stream.auth.token_url", tokenUrl);
    fields.put("event_stream.auth.user_pass.client_id", clientId);
    fields.put("event_stream.auth.user_pass.client_secret", clientSecret);
    fields.put("event_stream.auth.user_pass.username", username);
    fields.put("event_stream.auth.user_pass.password", password);

    List<String> missing = new ArrayList<>();
    fields.forEach((key, value) -> {
      if (value == null || value.isBlank()) {
        missing.add(key);
      }
    });
    if (!missing.isEmpty()) {
      throw new ConfigException("Missing required credential settings: " + String.join(", ", missing));
    }

    try {
      Credentials resolved = new Credentials(
          Credentials.PASSWORD_GRANT, clientId, clientSecret, username, password, tokenUrl);
      log.info("Resolved credentials for user {} against {}", resolved.username(), resolved.tokenUrl());
      return new CredentialContext(resolved);
    } catch (IllegalArgumentException ex) {
      throw new ConfigException("Invalid credential settings: " + ex.getMessage(), ex);
    }
  }

  /**
   * Wraps already-resolved credentials, for callers that build them programmatically.
   *
   * @param credentials resolved credentials
   * @return context exposing {@code credentials}
   */
  public static CredentialContext of(Credentials credentials) {
    return new CredentialContext(Objects.requireNonNull(credentials, "credentials"));
  }

  /**
   * Returns the resolved credentials.
   *
   * @return immutable credentials
   */
  public Credentials credentials() {
    return credentials;
  }
}
