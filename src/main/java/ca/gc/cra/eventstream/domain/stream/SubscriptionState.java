package ca.gc.cra.eventstream.domain.stream;

/**
 * States of a topic subscription worker.
 *
 * @since 0.1.0
 */
public enum SubscriptionState {
  /** Opening a new stream segment. */
  SUBSCRIBING,
  /** Receiving events from an open segment. */
  STREAMING,
  /** Segment ended; waiting out the reconnect backoff. */
  RECONNECTING,
  /** Worker observed cancellation and exited. */
  STOPPED
}
