package ca.gc.cra.eventstream.application.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CancellationSignalTest {

  @Test
  void callbacksFireOnceOnCancel() {
    CancellationSignal signal = new CancellationSignal();
    AtomicInteger fired = new AtomicInteger();
    signal.onCancel(fired::incrementAndGet);

    signal.cancel();
    signal.cancel();

    assertTrue(signal.isCancelled());
    assertEquals(1, fired.get());
  }

  @Test
  void registrationAfterCancelFiresImmediately() {
    CancellationSignal signal = new CancellationSignal();
    signal.cancel();
    AtomicInteger fired = new AtomicInteger();

    signal.onCancel(fired::incrementAndGet);

    assertEquals(1, fired.get());
  }

  @Test
  void closedRegistrationIsNotFired() {
    CancellationSignal signal = new CancellationSignal();
    AtomicInteger fired = new AtomicInteger();
    try (CancellationSignal.Registration ignored = signal.onCancel(fired::incrementAndGet)) {
      assertFalse(signal.isCancelled());
    }

    signal.cancel();

    assertEquals(0, fired.get());
  }

  @Test
  void failingCallbackDoesNotBlockOthers() {
    CancellationSignal signal = new CancellationSignal();
    AtomicInteger fired = new AtomicInteger();
    signal.onCancel(() -> {
      throw new IllegalStateException("boom");
    });
    signal.onCancel(fired::incrementAndGet);

    signal.cancel();

    assertEquals(1, fired.get());
  }

  @Test
  void awaitReportsCancellation() throws Exception {
    CancellationSignal signal = new CancellationSignal();
    assertFalse(signal.await(10, TimeUnit.MILLISECONDS));

    new Thread(signal::cancel).start();

    assertTrue(signal.await(2, TimeUnit.SECONDS));
  }
}
