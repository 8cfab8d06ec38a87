package ca.gc.cra.eventstream.adapter.kafka;

import java.util.Map;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Partitioner;
import org.apache.kafka.common.Cluster;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Builds {@link MockProducer} instances through the constructor shared by Kafka 3.x and 4.x.
 */
final class MockProducerFactory {
  private static final Partitioner SINGLE_PARTITION = new Partitioner() {
    @Override
    public void configure(Map<String, ?> configs) {}

    @Override
    public int partition(
        String topic, Object key, byte[] keyBytes, Object value, byte[] valueBytes, Cluster cluster) {
      return 0;
    }

    @Override
    public void close() {}
  };

  private MockProducerFactory() {}

  static MockProducer<String, byte[]> autoCompleting() {
    return new MockProducer<>(true, SINGLE_PARTITION, new StringSerializer(), new ByteArraySerializer());
  }

  static MockProducer<String, byte[]> manual() {
    return new MockProducer<>(false, SINGLE_PARTITION, new StringSerializer(), new ByteArraySerializer());
  }
}
