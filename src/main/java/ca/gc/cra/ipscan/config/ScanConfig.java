package ca.gc.cra.ipscan.config;

import ca.gc.cra.ipscan.validation.Net;
import ca.gc.cra.ipscan.validation.Numbers;
import ca.gc.cra.ipscan.validation.Paths;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated settings for the scan pipeline, the result store and the run loop.
 * <p><strong>Why:</strong> Collects every tunable in one immutable value so the composition root and the dry-run plan
 * see the same numbers.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param filePath log file scanned each cycle
 * @param chunkSizeBytes bytes read per chunk (1 B to 256 MiB)
 * @param workers scan worker threads (1-256)
 * @param storeConnectionURI MongoDB connection string
 * @param databaseName database holding both result collections
 * @param privateCollectionName collection for private addresses
 * @param publicCollectionName collection for public addresses
 * @param runInterval idle delay between cycles (0 s to 24 h)
 * @since 0.1.0
 */
public record ScanConfig(
    Path filePath,
    int chunkSizeBytes,
    int workers,
    String storeConnectionURI,
    String databaseName,
    String privateCollectionName,
    String publicCollectionName,
    Duration runInterval) {

  static final int DEFAULT_CHUNK_SIZE_BYTES = 1024 * 1024;
  static final int MAX_CHUNK_SIZE_BYTES = 256 * 1024 * 1024;
  static final int MAX_WORKERS = 256;
  static final long DEFAULT_RUN_INTERVAL_SECONDS = 10;
  static final long MAX_RUN_INTERVAL_SECONDS = 24L * 60 * 60;

  public ScanConfig {
    Objects.requireNonNull(filePath, "filePath");
    Numbers.requireRange("chunkSizeBytes", chunkSizeBytes, 1, MAX_CHUNK_SIZE_BYTES);
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    Objects.requireNonNull(storeConnectionURI, "storeConnectionURI");
    Objects.requireNonNull(databaseName, "databaseName");
    Objects.requireNonNull(privateCollectionName, "privateCollectionName");
    Objects.requireNonNull(publicCollectionName, "publicCollectionName");
    Objects.requireNonNull(runInterval, "runInterval");
    if (runInterval.isNegative()) {
      throw new IllegalArgumentException("runInterval must not be negative");
    }
    if (privateCollectionName.equals(publicCollectionName)) {
      throw new IllegalArgumentException(
          "privateCollectionName and publicCollectionName must differ (both were " + privateCollectionName + ")");
    }
  }

  /**
   * Built-in defaults: {@code data/access.log}, 1 MiB chunks, one worker per core, a MongoDB service named
   * {@code mongodb}, database {@code ip_extraction}, collections {@code private_ips} and {@code public_ips}, and a
   * 10 second interval.
   *
   * @return default configuration
   */
  public static ScanConfig defaults() {
    return new ScanConfig(
        Path.of("data", "access.log"),
        DEFAULT_CHUNK_SIZE_BYTES,
        defaultWorkers(),
        "mongodb://mongodb:27017",
        "ip_extraction",
        "private_ips",
        "public_ips",
        Duration.ofSeconds(DEFAULT_RUN_INTERVAL_SECONDS));
  }

  /**
   * Builds a configuration from a flat key/value map, falling back to {@link #defaults()} for absent or blank keys.
   *
   * @param options merged configuration (CLI, YAML, environment, defaults)
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range; the message names the key
   */
  public static ScanConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ScanConfig defaults = defaults();

    Path filePath = isBlank(options.get("filePath"))
        ? defaults.filePath()
        : Paths.parsePath("filePath", options.get("filePath"));
    int chunkSize = isBlank(options.get("chunkSizeBytes"))
        ? defaults.chunkSizeBytes()
        : Numbers.parseIntInRange("chunkSizeBytes", options.get("chunkSizeBytes"), 1, MAX_CHUNK_SIZE_BYTES);
    int workers = isBlank(options.get("workers"))
        ? defaults.workers()
        : Numbers.parseIntInRange("workers", options.get("workers"), 1, MAX_WORKERS);
    String uri = isBlank(options.get("storeConnectionURI"))
        ? defaults.storeConnectionURI()
        : Net.validateStoreUri("storeConnectionURI", options.get("storeConnectionURI"));
    String database = isBlank(options.get("databaseName"))
        ? defaults.databaseName()
        : Net.validateDatabaseName("databaseName", options.get("databaseName"));
    String privateCollection = collection(options, "privateCollectionName", defaults.privateCollectionName());
    String publicCollection = collection(options, "publicCollectionName", defaults.publicCollectionName());
    long intervalSeconds = isBlank(options.get("runIntervalSeconds"))
        ? defaults.runInterval().toSeconds()
        : Numbers.parseIntInRange(
            "runIntervalSeconds", options.get("runIntervalSeconds"), 0, (int) MAX_RUN_INTERVAL_SECONDS);

    return new ScanConfig(
        filePath,
        chunkSize,
        workers,
        uri,
        database,
        privateCollection,
        publicCollection,
        Duration.ofSeconds(intervalSeconds));
  }

  private static String collection(Map<String, String> options, String key, String fallback) {
    String raw = options.get(key);
    return isBlank(raw) ? fallback : Net.validateCollectionName(key, raw);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static int defaultWorkers() {
    return Math.max(1, Math.min(MAX_WORKERS, Runtime.getRuntime().availableProcessors()));
  }
}
