package ca.gc.cra.ipscan.application.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Fixed-interval scheduler that runs a cycle, sleeps, and repeats until interrupted.
 * <p><strong>Why:</strong> Periodic rescans must survive any single failed cycle; failures are logged and the next
 * cycle starts after the usual delay.</p>
 * <p><strong>Role:</strong> Outermost application loop, decoupled from what a cycle does.</p>
 * <p><strong>Thread-safety:</strong> Runs on the calling thread; cycles never overlap.</p>
 * <p><strong>Observability:</strong> Tags every log line emitted during a cycle with MDC key {@code runId}.</p>
 *
 * @implNote The delay is fixed and applied after both successful and failed cycles. There is no failure cap and no
 * backoff growth.
 * @since 0.1.0
 */
public final class RunLoop {
  private static final Logger log = LoggerFactory.getLogger(RunLoop.class);
  static final String RUN_ID_KEY = "runId";

  /**
   * Unit of work executed once per iteration.
   */
  @FunctionalInterface
  public interface Cycle {
    /**
     * Runs one cycle.
     *
     * @throws Exception any failure; logged and swallowed by the loop except {@link InterruptedException}
     */
    void run() throws Exception;
  }

  /**
   * Runs {@code cycle} forever with {@code interval} between the end of one cycle and the start of the next.
   *
   * <p>Returns only when the calling thread is interrupted, either while sleeping, while a cycle runs, or by a cycle
   * that throws {@link InterruptedException}. The interrupt flag is preserved on return.</p>
   *
   * @param interval idle delay between cycles; must not be negative
   * @param cycle work to execute each iteration
   * @return number of cycles started
   */
  public long runForever(Duration interval, Cycle cycle) {
    Objects.requireNonNull(interval, "interval");
    Objects.requireNonNull(cycle, "cycle");
    if (interval.isNegative()) {
      throw new IllegalArgumentException("interval must not be negative");
    }

    long cycles = 0;
    while (!Thread.currentThread().isInterrupted()) {
      cycles++;
      String previousRunId = MDC.get(RUN_ID_KEY);
      try {
        MDC.put(RUN_ID_KEY, Long.toString(cycles));
        log.info("Starting scan cycle {}", cycles);
        cycle.run();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Scan cycle {} interrupted; stopping run loop", cycles);
        break;
      } catch (Exception ex) {
        log.error("Scan cycle {} failed", cycles, ex);
      } finally {
        if (previousRunId == null) {
          MDC.remove(RUN_ID_KEY);
        } else {
          MDC.put(RUN_ID_KEY, previousRunId);
        }
      }

      if (Thread.currentThread().isInterrupted()) {
        break;
      }
      try {
        log.info("Sleeping for {} seconds", interval.toSeconds());
        TimeUnit.MILLISECONDS.sleep(interval.toMillis());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.info("Run loop interrupted while sleeping; stopping");
      }
    }
    log.info("Run loop stopped after {} cycles", cycles);
    return cycles;
  }
}
