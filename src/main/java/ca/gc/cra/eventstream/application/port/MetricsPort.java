package ca.gc.cra.eventstream.application.port;

/**
 * <strong>What:</strong> Port abstracting relay metrics emission.
 * <p><strong>Why:</strong> Lets workers and the normalizer count reconnects, rejects, and throughput without
 * binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every subscription
 * worker and the consumer thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code stream.segment.errors}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name (e.g., {@code stream.subscribe.attempts}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value; units defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
