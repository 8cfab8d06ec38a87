package ca.gc.cra.eventstream.domain.error;

/**
 * Base checked exception for event stream relay failures.
 *
 * <p>Subclasses split into startup failures that terminate the process ({@link ConfigException},
 * {@link AuthException}, {@link PreflightException}) and steady-state failures that are logged and
 * recovered from ({@link StreamException}, {@link DecodeException}).</p>
 *
 * @since 0.1.0
 */
public abstract class EventStreamException extends Exception {
  private static final long serialVersionUID = 1L;

  protected EventStreamException(String message) {
    super(message);
  }

  protected EventStreamException(String message, Throwable cause) {
    super(message, cause);
  }
}
