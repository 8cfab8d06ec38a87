package ca.gc.cra.eventstream.domain.error;

/**
 * Raised when a configured topic cannot be subscribed to or its metadata lookup fails. Aborts startup for every topic, not only the failing one.
 *
 * @since 0.1.0
 */
public final class PreflightException extends EventStreamException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public PreflightException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public PreflightException(String message, Throwable cause) {
    super(message, cause);
  }
}
