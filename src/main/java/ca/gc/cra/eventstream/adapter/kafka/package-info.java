/**
 * Kafka adapters that publish relayed events as JSON records.
 * <p><strong>Concurrency:</strong> Adapters delegate to thread-safe {@code KafkaProducer} instances.</p>
 * <p><strong>Metrics:</strong> Emits {@code sink.kafka.sent} and {@code sink.kafka.failed}.</p>
 */
package ca.gc.cra.eventstream.adapter.kafka;
