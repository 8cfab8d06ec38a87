/**
 * Metrics adapters that bridge the relay's metrics port to OpenTelemetry or a no-op implementation.
 * <p><strong>Concurrency:</strong> Implementations accept concurrent updates from every subscription worker.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code stream.*}, {@code preflight.*}, {@code normalizer.*}, and
 * {@code pipeline.*}.</p>
 * <p><strong>Security:</strong> Never exports event payloads; only counters and timings.</p>
 */
package ca.gc.cra.eventstream.infrastructure.metrics;
