package ca.gc.cra.eventstream.infrastructure.exec;

import ca.gc.cra.eventstream.validation.Numbers;
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the relay's worker pools.
 *
 * @since 0.1.0
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final int MAX_WORKERS = 64;

  private ExecutorFactories() {}

  /**
   * Builds a pool that runs exactly one long-lived subscription worker per thread.
   *
   * <p>The pool has no task queue, so a worker submitted beyond {@code workers} is rejected rather than
   * parked behind a subscription that never finishes.</p>
   *
   * @param workers number of worker threads, one per topic; 1..64
   * @param prefix thread name prefix; blank falls back to {@code stream-worker}
   * @param handler handler for errors escaping a worker; {@code null} logs them
   * @return executor service ready to accept {@code workers} tasks
   * @throws IllegalArgumentException when {@code workers} is out of range
   */
  public static ExecutorService newSubscriptionPool(int workers, String prefix, UncaughtExceptionHandler handler) {
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    ThreadFactory factory = new WorkerThreadFactory(prefix, handler);
    return new ThreadPoolExecutor(
        workers,
        workers,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        (task, pool) -> {
          throw new RejectedExecutionException(
              "Subscription pool is sized for " + pool.getMaximumPoolSize() + " worker(s); extra worker rejected");
        });
  }

  private static final class WorkerThreadFactory implements ThreadFactory {
    private final String prefix;
    private final UncaughtExceptionHandler handler;
    private final AtomicInteger index = new AtomicInteger();

    private WorkerThreadFactory(String prefix, UncaughtExceptionHandler handler) {
      this.prefix = prefix == null || prefix.isBlank() ? "stream-worker" : prefix.trim();
      this.handler = handler != null
          ? handler
          : (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex);
    }

    @Override
    public Thread newThread(Runnable task) {
      // non-daemon: the JVM waits for workers to observe cancellation
      Thread thread = new Thread(task, prefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(handler);
      return thread;
    }
  }
}
