package ca.gc.cra.eventstream.domain.error;

/**
 * Raised when configuration is malformed or inconsistent, e.g. a replay preset that disagrees with the configured replay id. Fatal before startup; never retried.
 *
 * @since 0.1.0
 */
public final class ConfigException extends EventStreamException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public ConfigException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
