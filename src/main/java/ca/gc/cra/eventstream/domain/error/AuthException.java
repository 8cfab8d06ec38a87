package ca.gc.cra.eventstream.domain.error;

/**
 * Raised when credential resolution or the authentication handshake fails. Fatal at startup.
 *
 * @since 0.1.0
 */
public final class AuthException extends EventStreamException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public AuthException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public AuthException(String message, Throwable cause) {
    super(message, cause);
  }
}
