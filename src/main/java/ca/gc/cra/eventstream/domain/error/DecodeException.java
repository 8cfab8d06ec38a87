package ca.gc.cra.eventstream.domain.error;

/**
 * Raised when a raw event lacks or mistypes its routing metadata. The normalizer rejects the single event and keeps consuming.
 *
 * @since 0.1.0
 */
public final class DecodeException extends EventStreamException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public DecodeException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
