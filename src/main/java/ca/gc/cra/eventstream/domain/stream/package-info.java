/**
 * Value types for topic subscriptions, replay positions, and normalized events.
 * <p><strong>Concurrency:</strong> Records are immutable. {@link ca.gc.cra.eventstream.domain.stream.TopicSubscription}
 * is single-writer (its worker) and many-reader.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.eventstream.domain.stream;
