package ca.gc.cra.eventstream.application.stream;

import ca.gc.cra.eventstream.validation.Numbers;
import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Exponential reconnect backoff with symmetric jitter.
 *
 * <p>The undithered delay for the {@code n}-th consecutive unproductive segment is
 * {@code initial * multiplier^(n-1)}, capped at {@code max}. Jitter then scales it by a factor drawn
 * uniformly from {@code [1 - jitter, 1 + jitter]}, and the result is capped at {@code max} again.</p>
 *
 * @param initial delay after the first unproductive segment
 * @param max upper bound for any delay
 * @param multiplier growth factor per consecutive failure; at least {@code 1.0}
 * @param jitter jitter fraction within {@code [0.0, 1.0]}
 * @since 0.1.0
 */
public record BackoffPolicy(Duration initial, Duration max, double multiplier, double jitter) {
  private static final long MAX_DELAY_MILLIS = Duration.ofHours(1).toMillis();

  /**
   * Validates the policy bounds.
   */
  public BackoffPolicy {
    Objects.requireNonNull(initial, "initial");
    Objects.requireNonNull(max, "max");
    Numbers.requireRange("backoff.initial_ms", initial.toMillis(), 1, MAX_DELAY_MILLIS);
    Numbers.requireRange("backoff.max_ms", max.toMillis(), initial.toMillis(), MAX_DELAY_MILLIS);
    if (Double.isNaN(multiplier) || multiplier < 1d || multiplier > 10d) {
      throw new IllegalArgumentException("backoff.multiplier must be within [1.0,10.0] (was " + multiplier + ')');
    }
    if (Double.isNaN(jitter) || jitter < 0d || jitter > 1d) {
      throw new IllegalArgumentException("backoff.jitter must be within [0.0,1.0] (was " + jitter + ')');
    }
  }

  /**
   * Returns the default policy: 1s initial, 60s cap, doubling, 20% jitter.
   *
   * @return default policy
   */
  public static BackoffPolicy defaults() {
    return new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 2d, 0.2d);
  }

  /**
   * Computes the delay before the next subscribe attempt.
   *
   * @param consecutiveFailures number of unproductive segments in a row; {@code 0} means no wait
   * @param random source of uniform values in {@code [0.0, 1.0)}
   * @return delay in milliseconds, within {@code [0, max]}
   */
  public long delayMillis(int consecutiveFailures, DoubleSupplier random) {
    if (consecutiveFailures <= 0) {
      return 0L;
    }
    double capMillis = max.toMillis();
    double base = initial.toMillis() * Math.pow(multiplier, consecutiveFailures - 1);
    base = Math.min(base, capMillis);
    double factor = 1d + jitter * (2d * random.getAsDouble() - 1d);
    double jittered = Math.min(base * factor, capMillis);
    return Math.max(0L, Math.round(jittered));
  }
}
