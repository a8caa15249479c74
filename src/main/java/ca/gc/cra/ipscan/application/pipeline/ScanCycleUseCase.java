package ca.gc.cra.ipscan.application.pipeline;

import ca.gc.cra.ipscan.application.port.MetricsPort;
import ca.gc.cra.ipscan.application.port.ResultStoreConnector;
import ca.gc.cra.ipscan.application.port.ResultStorePort;
import ca.gc.cra.ipscan.application.port.StoreConnectionException;
import ca.gc.cra.ipscan.application.port.StoreWriteException;
import ca.gc.cra.ipscan.domain.address.AddressClass;
import ca.gc.cra.ipscan.domain.address.ExtractionResult;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Executes one scan cycle: connect to the result store, extract the log file, replace the
 * private and public collections, log the counts, close the store.
 * <p><strong>Why:</strong> Each cycle publishes a full snapshot, so consumers never need to reconcile deltas.</p>
 * <p><strong>Role:</strong> Application use case driven by {@link RunLoop} or by a one-shot CLI invocation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Abort before extraction and before any write when the store is unreachable.</li>
 *   <li>Write the extraction result even when it is empty, clearing prior results.</li>
 *   <li>Skip writes when the thread was interrupted during extraction.</li>
 *   <li>Close the store on every exit path.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not intended for concurrent cycles; {@link RunLoop} runs them sequentially.</p>
 * <p><strong>Observability:</strong> Logs {@code Private IPs: N} and {@code Public IPs: N}; emits
 * {@code cycle.success}, {@code cycle.failure}, {@code store.connect.failed} and {@code cycle.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class ScanCycleUseCase {
  private static final Logger log = LoggerFactory.getLogger(ScanCycleUseCase.class);

  private final ResultStoreConnector connector;
  private final ExtractionPipeline pipeline;
  private final Path file;
  private final MetricsPort metrics;

  /**
   * Creates a cycle bound to one input file and one store.
   *
   * @param connector opens the result store at the start of each cycle
   * @param pipeline extraction pipeline
   * @param file log file to scan
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public ScanCycleUseCase(
      ResultStoreConnector connector, ExtractionPipeline pipeline, Path file, MetricsPort metrics) {
    this.connector = Objects.requireNonNull(connector, "connector");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.file = Objects.requireNonNull(file, "file");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Runs one cycle.
   *
   * @return the persisted result, or empty when the cycle was aborted before writing (store unreachable or
   *     interrupted during extraction)
   * @throws StoreWriteException when replacing either collection fails; the store is still closed
   */
  public Optional<ExtractionResult> runOnce() throws StoreWriteException {
    long started = System.nanoTime();
    ResultStorePort store;
    try {
      store = connector.open();
    } catch (StoreConnectionException ex) {
      log.error("Failed to connect to result store: {}", ex.getMessage(), ex);
      metrics.increment("store.connect.failed");
      metrics.increment("cycle.failure");
      return Optional.empty();
    }

    boolean success = false;
    try (store) {
      ExtractionResult result = pipeline.extract(file);
      if (Thread.currentThread().isInterrupted()) {
        log.warn("Scan cycle interrupted; leaving stored results untouched");
        return Optional.empty();
      }
      store.replace(AddressClass.PRIVATE, result.privateAddresses());
      store.replace(AddressClass.PUBLIC, result.publicAddresses());
      log.info("Private IPs: {}", result.privateAddresses().size());
      log.info("Public IPs: {}", result.publicAddresses().size());
      if (!result.excludedAddresses().isEmpty()) {
        log.debug("Excluded {} unspecified, multicast or reserved literals", result.excludedAddresses().size());
      }
      success = true;
      return Optional.of(result);
    } finally {
      metrics.increment(success ? "cycle.success" : "cycle.failure");
      metrics.observe("cycle.latencyNanos", System.nanoTime() - started);
    }
  }
}
