/**
 * <strong>Purpose:</strong> Ports between the subscription core and its collaborators.
 * <p><strong>Inbound:</strong> {@link ca.gc.cra.eventstream.application.port.PubSubClient} and
 * {@link ca.gc.cra.eventstream.application.port.EventStream} model the remote publish/subscribe service.</p>
 * <p><strong>Outbound:</strong> {@link ca.gc.cra.eventstream.application.port.EventReceiver} and
 * {@link ca.gc.cra.eventstream.application.port.EventSink} model the downstream pipeline.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.eventstream.application.port;
