/**
 * Local event sinks: structured logging and an in-memory collector.
 * <p><strong>Security:</strong> The logging sink truncates long payload values; it does not redact field
 * contents, so enable it only where event payloads may be logged.</p>
 */
package ca.gc.cra.eventstream.infrastructure.sink;
