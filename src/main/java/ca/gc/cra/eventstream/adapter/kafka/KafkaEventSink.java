package ca.gc.cra.eventstream.adapter.kafka;

import ca.gc.cra.eventstream.application.port.EventSink;
import ca.gc.cra.eventstream.application.port.MetricsPort;
import ca.gc.cra.eventstream.domain.stream.Event;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Base64;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link EventSink} that publishes normalized events to a Kafka topic as JSON.
 * <p><strong>Why:</strong> Hands relayed events to downstream consumers running on other hosts.</p>
 * <p><strong>Format:</strong> One JSON object per record:
 * {@code {"schemaVersion":1,"type":...,"timestamp":"<ISO-8601>","payload":{...}}}. The record key is the
 * event type so events of one type stay ordered within a partition.</p>
 * <p><strong>Thread-safety:</strong> Mirrors the provided {@link Producer}; the default {@link KafkaProducer}
 * is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class KafkaEventSink implements EventSink {
  private static final Logger log = LoggerFactory.getLogger(KafkaEventSink.class);
  static final int SCHEMA_VERSION = 1;

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final MetricsPort metrics;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates a sink backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param topic Kafka topic that receives events; must not be blank
   * @param metrics metrics adapter; may be {@code null}
   * @throws IllegalArgumentException if any parameter is blank
   */
  public KafkaEventSink(String bootstrapServers, String topic, MetricsPort metrics) {
    this(createProducer(bootstrapServers), topic, metrics);
  }

  KafkaEventSink(Producer<String, byte[]> producer, String topic, MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = sanitizeTopic(topic);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Serializes and enqueues the event.
   *
   * @param event event to publish; must not be {@code null}
   * @throws UncheckedIOException if the payload cannot be serialized
   */
  @Override
  public void export(Event event) {
    Objects.requireNonNull(event, "event");
    byte[] payload = serialize(event);
    producer.send(new ProducerRecord<>(topic, event.type(), payload), (metadata, ex) -> {
      if (ex != null) {
        metrics.increment("sink.kafka.failed");
        log.error("Kafka publish failure for topic {} event type {}", topic, event.type(), ex);
      }
    });
    metrics.increment("sink.kafka.sent");
  }

  byte[] serialize(Event event) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("type", event.type());
      gen.writeStringField("timestamp", event.timestamp().toString());
      gen.writeFieldName("payload");
      writeValue(gen, event.payload());
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize " + event.type() + " event", ex);
    }
    return out.toByteArray();
  }

  private static void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof CharSequence text) {
      gen.writeString(text.toString());
    } else if (value instanceof Boolean bool) {
      gen.writeBoolean(bool);
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      gen.writeNumber(integer);
    } else if (value instanceof Double || value instanceof Float) {
      gen.writeNumber(((Number) value).doubleValue());
    } else if (value instanceof Number number) {
      gen.writeNumber(number.longValue());
    } else if (value instanceof byte[] bytes) {
      gen.writeString(Base64.getEncoder().encodeToString(bytes));
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Collection<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else {
      gen.writeString(value.toString());
    }
  }

  /**
   * Flushes pending records and closes the producer.
   */
  @Override
  public void close() {
    try {
      producer.flush();
    } catch (RuntimeException ex) {
      log.warn("Kafka producer flush failed during shutdown", ex);
    } finally {
      producer.close(Duration.ofSeconds(5));
    }
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    String trimmed = bootstrapServers.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }

  private static String sanitizeTopic(String topic) {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    return topic.trim();
  }
}
