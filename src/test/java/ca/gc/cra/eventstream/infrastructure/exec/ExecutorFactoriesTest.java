package ca.gc.cra.eventstream.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void namesNonDaemonThreadsAndRejectsOverflow() throws Exception {
    ExecutorService pool = ExecutorFactories.newSubscriptionPool(1, "stream-worker", null);
    CountDownLatch release = new CountDownLatch(1);
    CompletableFuture<Thread> running = new CompletableFuture<>();
    try {
      pool.execute(() -> {
        running.complete(Thread.currentThread());
        try {
          release.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      });
      Thread worker = running.get(2, TimeUnit.SECONDS);
      assertTrue(worker.getName().startsWith("stream-worker-"));
      assertFalse(worker.isDaemon());

      assertThrows(RejectedExecutionException.class, () -> pool.execute(() -> {}));
    } finally {
      release.countDown();
      pool.shutdown();
      assertTrue(pool.awaitTermination(2, TimeUnit.SECONDS));
    }
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newSubscriptionPool(0, "x", null));
  }
}
