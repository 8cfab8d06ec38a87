package ca.gc.cra.eventstream.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private static final String[] PROPERTIES = {
      "otel.metrics.exporter", "otel.exporter.otlp.endpoint", "otel.resource.attributes"};

  @AfterEach
  void clearProperties() {
    for (String property : PROPERTIES) {
      System.clearProperty(property);
    }
  }

  @Test
  void movesTelemetryArgumentsIntoSystemProperties() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "NONE",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "deployment.environment=dev",
        "event_stream.topics", "/event/LoginEventStream"));

    TelemetryConfigurator.configureMetrics(args);

    assertEquals("none", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("deployment.environment=dev", System.getProperty("otel.resource.attributes"));
    assertEquals(Map.of("event_stream.topics", "/event/LoginEventStream"), args);
  }

  @Test
  void rejectsUnknownExporter() {
    Map<String, String> args = new HashMap<>(Map.of("metricsExporter", "prometheus"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(args));
    assertFalse(System.getProperties().containsKey("otel.metrics.exporter"));
  }
}
