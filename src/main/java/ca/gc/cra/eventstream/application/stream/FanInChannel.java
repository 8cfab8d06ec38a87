package ca.gc.cra.eventstream.application.stream;

import ca.gc.cra.eventstream.application.util.CancellationSignal;
import ca.gc.cra.eventstream.domain.stream.RawEvent;
import ca.gc.cra.eventstream.validation.Numbers;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single delivery channel shared by every subscription worker and the consumer loop.
 *
 * <p>The default channel is unbuffered: a send blocks until the consumer takes the event, so a slow
 * downstream throttles every worker. A small bounded buffer may be configured instead. Ordering is
 * FIFO per sender; across senders it is whatever the arrival interleaving happens to be.</p>
 *
 * <p>Blocking operations wait in short slices and give up as soon as the supplied
 * {@link CancellationSignal} fires.</p>
 *
 * @since 0.1.0
 */
public final class FanInChannel {
  private static final Duration DEFAULT_SLICE = Duration.ofMillis(25);
  private static final int MAX_CAPACITY = 65_536;

  private final BlockingQueue<RawEvent> queue;
  private final long sliceNanos;
  private final int capacity;

  private FanInChannel(BlockingQueue<RawEvent> queue, int capacity, Duration slice) {
    this.queue = queue;
    this.capacity = capacity;
    this.sliceNanos = Objects.requireNonNull(slice, "slice").toNanos();
    if (sliceNanos <= 0) {
      throw new IllegalArgumentException("slice must be positive");
    }
  }

  /**
   * Creates a rendezvous channel.
   *
   * @return unbuffered channel
   */
  public static FanInChannel unbuffered() {
    return new FanInChannel(new SynchronousQueue<>(), 0, DEFAULT_SLICE);
  }

  /**
   * Creates a channel with the given buffer capacity.
   *
   * @param capacity buffered events; {@code 0} selects a rendezvous channel
   * @return configured channel
   */
  public static FanInChannel withCapacity(int capacity) {
    return withCapacity(capacity, DEFAULT_SLICE);
  }

  static FanInChannel withCapacity(int capacity, Duration slice) {
    Numbers.requireRange("channel.capacity", capacity, 0, MAX_CAPACITY);
    BlockingQueue<RawEvent> queue =
        capacity == 0 ? new SynchronousQueue<>() : new ArrayBlockingQueue<>(capacity);
    return new FanInChannel(queue, capacity, slice);
  }

  /**
   * Hands an event to the consumer, blocking while the channel is full.
   *
   * @param event event to deliver
   * @param cancellation signal that abandons the send
   * @return {@code true} when the event was accepted; {@code false} when cancelled first
   * @throws InterruptedException when the sending thread is interrupted
   */
  public boolean send(RawEvent event, CancellationSignal cancellation) throws InterruptedException {
    Objects.requireNonNull(event, "event");
    while (!cancellation.isCancelled()) {
      if (queue.offer(event, sliceNanos, TimeUnit.NANOSECONDS)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Takes the next event, blocking while the channel is empty.
   *
   * @param cancellation signal that abandons the receive
   * @return next event, or empty when cancelled first
   * @throws InterruptedException when the receiving thread is interrupted
   */
  public Optional<RawEvent> receive(CancellationSignal cancellation) throws InterruptedException {
    while (!cancellation.isCancelled()) {
      RawEvent event = queue.poll(sliceNanos, TimeUnit.NANOSECONDS);
      if (event != null) {
        return Optional.of(event);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the configured buffer capacity.
   *
   * @return capacity; {@code 0} for a rendezvous channel
   */
  public int capacity() {
    return capacity;
  }
}
