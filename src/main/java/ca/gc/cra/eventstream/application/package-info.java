/**
 * Application layer orchestration for the event stream relay.
 * <p><strong>Role:</strong> Hosts use cases and ports that coordinate subscribe → fan-in → normalize → export.</p>
 * <p><strong>Concurrency:</strong> Use cases manage worker pools explicitly; interfaces document caller responsibilities.</p>
 * <p><strong>Security:</strong> Relies on validation utilities to reject unsafe configuration before activating adapters.</p>
 */
package ca.gc.cra.eventstream.application;
