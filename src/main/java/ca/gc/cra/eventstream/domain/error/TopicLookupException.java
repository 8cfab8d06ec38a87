package ca.gc.cra.eventstream.domain.error;

/**
 * Raised by the protocol client when topic metadata cannot be fetched.
 *
 * @since 0.1.0
 */
public final class TopicLookupException extends EventStreamException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public TopicLookupException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public TopicLookupException(String message, Throwable cause) {
    super(message, cause);
  }
}
