package ca.gc.cra.eventstream.application.port;

import ca.gc.cra.eventstream.application.util.CancellationSignal;

/**
 * Receiver side of the downstream pipeline contract.
 *
 * <p>The pipeline host calls {@link #pollEvents} on a thread it owns; the receiver delivers events
 * into the supplied sink until the signal is cancelled.</p>
 *
 * @since 0.1.0
 */
public interface EventReceiver {
  /**
   * Returns the receiver identity used in logs and metrics.
   *
   * @return stable receiver id
   */
  String id();

  /**
   * Delivers events into {@code sink} until {@code cancellation} fires.
   *
   * @param cancellation signal that ends the loop; returning after cancellation is not an error
   * @param sink destination for normalized events
   */
  void pollEvents(CancellationSignal cancellation, EventSink sink);
}
