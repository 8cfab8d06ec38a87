/**
 * Subscription core: startup validation, per-topic workers, fan-in, and normalization.
 * <p><strong>Concurrency:</strong> One worker thread per topic plus one consumer thread, coordinated only
 * through {@link ca.gc.cra.eventstream.application.stream.FanInChannel} and a shared
 * {@link ca.gc.cra.eventstream.application.util.CancellationSignal}.</p>
 * <p><strong>Metrics:</strong> Emits {@code stream.*}, {@code preflight.*}, and {@code normalizer.*}
 * counters.</p>
 */
package ca.gc.cra.eventstream.application.stream;
