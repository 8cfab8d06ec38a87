package ca.gc.cra.eventstream.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {

  @Test
  void exporterNoneFallsBackToNoop() {
    Map<String, String> settings = Map.of("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(settings::get);

    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.meter().counterBuilder("ignored").build().add(1);
    result.close();
  }

  @Test
  void parsesResourceAttributesAndSkipsMalformedEntries() {
    Attributes attributes =
        OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=dev, bogus ,team=relay,=x");

    assertEquals(2, attributes.size());
    assertEquals("dev", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("relay", attributes.get(AttributeKey.stringKey("team")));
  }
}
