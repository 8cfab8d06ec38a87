package ca.gc.cra.eventstream.application.port;

import ca.gc.cra.eventstream.domain.error.StreamException;
import ca.gc.cra.eventstream.domain.stream.ReceivedEvent;
import java.util.Optional;

/**
 * One live stream segment opened by {@link PubSubClient#subscribe}.
 *
 * <p>{@link #next()} blocks until the next decoded event arrives. {@link #close()} may be called from
 * another thread to abort a blocked {@link #next()}; the aborted call then returns empty or throws
 * {@link StreamException}.</p>
 *
 * @since 0.1.0
 */
public interface EventStream extends AutoCloseable {
  /**
   * Waits for the next event of this segment.
   *
   * @return next event with its replay position; empty when the segment ended cleanly
   * @throws StreamException when the segment ends abnormally
   * @throws InterruptedException when the waiting thread is interrupted
   */
  Optional<ReceivedEvent> next() throws StreamException, InterruptedException;

  /**
   * Closes the segment. Idempotent and safe to call concurrently with {@link #next()}.
   */
  @Override
  void close();
}
