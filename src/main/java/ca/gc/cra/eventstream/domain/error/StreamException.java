package ca.gc.cra.eventstream.domain.error;

/**
 * Raised when a live stream segment ends abnormally. Recoverable: the worker resubscribes from its last checkpoint.
 *
 * @since 0.1.0
 */
public final class StreamException extends EventStreamException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public StreamException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public StreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
