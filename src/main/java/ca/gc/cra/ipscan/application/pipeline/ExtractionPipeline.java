package ca.gc.cra.ipscan.application.pipeline;

import ca.gc.cra.ipscan.application.port.MetricsPort;
import ca.gc.cra.ipscan.domain.address.AddressClassifier;
import ca.gc.cra.ipscan.domain.address.ChunkResult;
import ca.gc.cra.ipscan.domain.address.ChunkScanner;
import ca.gc.cra.ipscan.domain.address.ExtractionResult;
import ca.gc.cra.ipscan.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads a log file in fixed-size byte chunks, scans and classifies the chunks in parallel, and
 * merges the per-chunk partitions into one sorted {@link ExtractionResult}.
 * <p><strong>Why:</strong> Large access logs are CPU-bound to scan; fanning chunks out to a worker pool keeps every
 * core busy while the reader stays a single sequential pass over the file.</p>
 * <p><strong>Role:</strong> Application-layer pipeline invoked once per scan cycle.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject missing, non-regular or empty inputs with an empty result.</li>
 *   <li>Bound in-flight chunks to twice the worker count so memory stays proportional to
 *   {@code chunkSizeBytes * workers}.</li>
 *   <li>Merge chunk results in completion order; the union is order-independent.</li>
 *   <li>Abort on the first I/O or worker failure and report an empty result.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each {@link #extract(Path)} call owns its pool and merge sets; concurrent calls on
 * one instance are safe but compete for CPU.</p>
 * <p><strong>Performance:</strong> One chunk copy per read; merge runs on the caller thread.</p>
 * <p><strong>Observability:</strong> Emits {@code scan.chunks.submitted}, {@code scan.bytes.read},
 * {@code scan.run.latencyNanos}, {@code scan.run.failed} and {@code scan.input.invalid}.</p>
 *
 * @implNote Chunks do not overlap. A literal straddling a chunk boundary is lost or truncated to a shorter match.
 * @since 0.1.0
 */
public final class ExtractionPipeline {
  private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);
  private static final String THREAD_PREFIX = "ip-scan";

  private final ChunkScanner scanner;
  private final AddressClassifier classifier;
  private final int chunkSizeBytes;
  private final int workers;
  private final MetricsPort metrics;

  /**
   * Creates a pipeline.
   *
   * @param scanner literal scanner shared by all workers
   * @param classifier classifier shared by all workers
   * @param chunkSizeBytes bytes per chunk; must be positive
   * @param workers worker thread count; must be positive
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public ExtractionPipeline(
      ChunkScanner scanner,
      AddressClassifier classifier,
      int chunkSizeBytes,
      int workers,
      MetricsPort metrics) {
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    if (chunkSizeBytes <= 0) {
      throw new IllegalArgumentException("chunkSizeBytes must be positive");
    }
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    this.chunkSizeBytes = chunkSizeBytes;
    this.workers = workers;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Extracts, classifies and sorts every IPv4 literal in {@code file}.
   *
   * <p>Never throws for input or processing problems: an unusable file, a read failure or a worker failure is logged
   * and reported as {@link ExtractionResult#empty()}. Interruption restores the thread's interrupt flag and also
   * returns the empty result.</p>
   *
   * @param file log file to scan
   * @return sorted, deduplicated partition of the file's literals
   */
  public ExtractionResult extract(Path file) {
    Objects.requireNonNull(file, "file");
    if (!isUsableInput(file)) {
      log.error("Invalid file: {}", file);
      metrics.increment("scan.input.invalid");
      return ExtractionResult.empty();
    }

    long started = System.nanoTime();
    ExecutorService pool = ExecutorFactories.newScanPool(
        workers,
        THREAD_PREFIX,
        (thread, ex) -> log.error("Uncaught failure on scan worker {}", thread.getName(), ex));
    boolean completed = false;
    try (InputStream in = Files.newInputStream(file)) {
      CompletionService<ChunkResult> completion = new ExecutorCompletionService<>(pool);
      Set<String> privateAddresses = new HashSet<>();
      Set<String> publicAddresses = new HashSet<>();
      Set<String> excludedAddresses = new HashSet<>();
      int maxInFlight = workers * 2;
      int inFlight = 0;
      long chunks = 0;
      long bytes = 0;

      byte[] chunk;
      while ((chunk = in.readNBytes(chunkSizeBytes)).length > 0) {
        if (inFlight == maxInFlight) {
          merge(completion.take().get(), privateAddresses, publicAddresses, excludedAddresses);
          inFlight--;
        }
        byte[] payload = chunk;
        completion.submit(() -> classifyChunk(payload));
        inFlight++;
        chunks++;
        bytes += payload.length;
        metrics.increment("scan.chunks.submitted");
      }
      while (inFlight > 0) {
        merge(completion.take().get(), privateAddresses, publicAddresses, excludedAddresses);
        inFlight--;
      }

      metrics.observe("scan.bytes.read", bytes);
      ExtractionResult result =
          ExtractionResult.sorted(privateAddresses, publicAddresses, excludedAddresses);
      completed = true;
      log.debug(
          "Scanned {} bytes in {} chunks from {}: private={}, public={}, excluded={}",
          bytes,
          chunks,
          file,
          result.privateAddresses().size(),
          result.publicAddresses().size(),
          result.excludedAddresses().size());
      return result;
    } catch (IOException ex) {
      log.error("Processing error reading {}", file, ex);
    } catch (ExecutionException ex) {
      log.error("Processing error in scan worker for {}", file, ex.getCause());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Extraction of {} interrupted; discarding partial results", file);
    } catch (RuntimeException ex) {
      log.error("Processing error while scanning {}", file, ex);
    } finally {
      if (completed) {
        pool.shutdown();
      } else {
        pool.shutdownNow();
      }
      metrics.observe("scan.run.latencyNanos", System.nanoTime() - started);
    }
    metrics.increment("scan.run.failed");
    return ExtractionResult.empty();
  }

  /**
   * Scans one chunk and partitions its distinct literals by class.
   *
   * @param chunk raw bytes
   * @return partition of the chunk's literals
   */
  ChunkResult classifyChunk(byte[] chunk) {
    Set<String> privateAddresses = new HashSet<>();
    Set<String> publicAddresses = new HashSet<>();
    Set<String> excludedAddresses = new HashSet<>();
    for (String candidate : scanner.scan(chunk)) {
      switch (classifier.classify(candidate)) {
        case PRIVATE -> privateAddresses.add(candidate);
        case PUBLIC -> publicAddresses.add(candidate);
        case INVALID -> excludedAddresses.add(candidate);
      }
    }
    return new ChunkResult(privateAddresses, publicAddresses, excludedAddresses);
  }

  private static void merge(
      ChunkResult result,
      Set<String> privateAddresses,
      Set<String> publicAddresses,
      Set<String> excludedAddresses) {
    privateAddresses.addAll(result.privateAddresses());
    publicAddresses.addAll(result.publicAddresses());
    excludedAddresses.addAll(result.excludedAddresses());
  }

  private static boolean isUsableInput(Path file) {
    try {
      return Files.isRegularFile(file) && Files.size(file) > 0;
    } catch (IOException ex) {
      log.debug("Unable to stat {}", file, ex);
      return false;
    }
  }
}
