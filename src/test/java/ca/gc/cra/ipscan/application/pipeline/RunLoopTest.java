package ca.gc.cra.ipscan.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ipscan.testutil.LogCapture;
import ch.qos.logback.classic.Level;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class RunLoopTest {
  private final RunLoop loop = new RunLoop();

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
    MDC.clear();
  }

  @Test
  void failingCycleIsLoggedAndLoopContinues() {
    List<String> runIds = new ArrayList<>();
    long cycles;
    try (LogCapture capture = LogCapture.attach(RunLoop.class)) {
      cycles = loop.runForever(Duration.ZERO, () -> {
        runIds.add(MDC.get(RunLoop.RUN_ID_KEY));
        if (runIds.size() == 1) {
          throw new IllegalStateException("boom");
        }
        if (runIds.size() == 3) {
          Thread.currentThread().interrupt();
        }
      });

      assertTrue(capture.contains(Level.ERROR, "Scan cycle 1 failed"));
      assertTrue(capture.contains(Level.INFO, "Starting scan cycle 3"));
    }

    assertEquals(3, cycles);
    assertEquals(List.of("1", "2", "3"), runIds);
    assertTrue(Thread.currentThread().isInterrupted());
    assertNull(MDC.get(RunLoop.RUN_ID_KEY));
  }

  @Test
  void cycleThrowingInterruptedExceptionStopsLoop() {
    long cycles = loop.runForever(Duration.ofSeconds(30), () -> {
      throw new InterruptedException("stop");
    });

    assertEquals(1, cycles);
    assertTrue(Thread.currentThread().isInterrupted());
  }

  @Test
  void interruptWhileSleepingStopsLoop() throws Exception {
    CountDownLatch firstCycle = new CountDownLatch(1);
    AtomicLong result = new AtomicLong(-1);
    Thread worker = new Thread(() -> result.set(loop.runForever(Duration.ofSeconds(60), firstCycle::countDown)));
    worker.start();

    assertTrue(firstCycle.await(5, TimeUnit.SECONDS));
    worker.interrupt();
    worker.join(TimeUnit.SECONDS.toMillis(5));

    assertEquals(1, result.get());
  }

  @Test
  void restoresPreviousRunId() {
    MDC.put(RunLoop.RUN_ID_KEY, "outer");

    loop.runForever(Duration.ZERO, () -> Thread.currentThread().interrupt());

    assertEquals("outer", MDC.get(RunLoop.RUN_ID_KEY));
  }

  @Test
  void rejectsNegativeInterval() {
    assertThrows(IllegalArgumentException.class, () -> loop.runForever(Duration.ofSeconds(-1), () -> {}));
  }
}
