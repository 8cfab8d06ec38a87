package ca.gc.cra.eventstream.domain.stream;

import ca.gc.cra.eventstream.logging.Logs;
import ca.gc.cra.eventstream.validation.Strings;

/**
 * Resolved authentication parameters for the remote publish/subscribe service.
 *
 * <p><strong>Thread-safety:</strong> Immutable; written once during startup and then shared by
 * reference with every component that needs it.</p>
 *
 * @param grantType OAuth grant type (the user/pass flow uses {@code password})
 * @param clientId connected-app client id
 * @param clientSecret connected-app client secret
 * @param username service account user name
 * @param password service account password
 * @param tokenUrl OAuth token endpoint
 * @since 0.1.0
 */
public record Credentials(
    String grantType,
    String clientId,
    String clientSecret,
    String username,
    String password,
    String tokenUrl) {

  /** Grant type used by the user/password flow. */
  public static final String PASSWORD_GRANT = "password";

  /**
   * Validates that every field is present.
   *
   * @throws NullPointerException when a field is {@code null}
   * @throws IllegalArgumentException when a field is blank
   */
  public Credentials {
    grantType = Strings.requireNonBlank("grant_type", grantType);
    clientId = Strings.requireNonBlank("client_id", clientId);
    clientSecret = Strings.requireNonBlank("client_secret", clientSecret);
    username = Strings.requireNonBlank("username", username);
    password = Strings.requireNonBlank("password", password);
    tokenUrl = Strings.requireNonBlank("token_url", tokenUrl);
  }

  @Override
  public String toString() {
    return "Credentials[grantType=" + grantType
        + ", clientId=" + Logs.redact(clientId)
        + ", clientSecret=" + Logs.redact(clientSecret)
        + ", username=" + username
        + ", password=" + Logs.redact(password)
        + ", tokenUrl=" + tokenUrl + ']';
  }
}
