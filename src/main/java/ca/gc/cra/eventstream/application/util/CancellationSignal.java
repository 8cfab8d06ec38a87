package ca.gc.cra.eventstream.application.util;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot cancellation signal shared by the consumer loop and every subscription worker.
 *
 * <p>Blocking code either waits on the signal directly ({@link #await}) or registers a callback
 * ({@link #onCancel}) that unblocks it, for example by closing an open stream segment. Callbacks run
 * exactly once, on the cancelling thread, or immediately when registered after cancellation.</p>
 *
 * <p><strong>Thread-safety:</strong> All methods are safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class CancellationSignal {
  private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final CountDownLatch latch = new CountDownLatch(1);
  private final Set<Registration> registrations = ConcurrentHashMap.newKeySet();

  /**
   * Indicates whether {@link #cancel()} has been called.
   *
   * @return {@code true} once cancelled
   */
  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Fires the signal and runs registered callbacks. Subsequent calls are no-ops.
   */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    latch.countDown();
    for (Registration registration : registrations) {
      registration.fire();
    }
  }

  /**
   * Waits until the signal fires or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @param unit unit of {@code timeout}
   * @return {@code true} when cancelled, {@code false} when the timeout elapsed first
   * @throws InterruptedException when the waiting thread is interrupted
   */
  public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
    return latch.await(timeout, unit);
  }

  /**
   * Registers a callback to run on cancellation.
   *
   * @param action callback; runs at most once
   * @return registration that removes the callback when closed
   */
  public Registration onCancel(Runnable action) {
    Registration registration = new Registration(Objects.requireNonNull(action, "action"));
    registrations.add(registration);
    if (cancelled.get()) {
      registration.fire();
    }
    return registration;
  }

  /**
   * Handle returned by {@link #onCancel}; closing it deregisters the callback.
   */
  public final class Registration implements AutoCloseable {
    private final Runnable action;

    private Registration(Runnable action) {
      this.action = action;
    }

    private void fire() {
      if (!registrations.remove(this)) {
        return;
      }
      try {
        action.run();
      } catch (RuntimeException ex) {
        log.warn("Cancellation callback failed", ex);
      }
    }

    @Override
    public void close() {
      registrations.remove(this);
    }
  }
}
