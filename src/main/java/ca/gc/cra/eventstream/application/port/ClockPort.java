package ca.gc.cra.eventstream.application.port;

/**
 * Wall-clock source used to stamp events that arrive without an {@code EventDate}.
 *
 * <p>Implementations must be thread-safe; tests supply a fixed value.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.eventstream.infrastructure.time.SystemClockAdapter
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();
}
