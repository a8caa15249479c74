package ca.gc.cra.ipscan.api;

import ca.gc.cra.ipscan.application.pipeline.ScanCycleUseCase;
import ca.gc.cra.ipscan.application.port.MetricsPort;
import ca.gc.cra.ipscan.config.CompositionRoot;
import ca.gc.cra.ipscan.config.ScanConfig;
import ca.gc.cra.ipscan.logging.LoggingConfigurator;
import ca.gc.cra.ipscan.logging.Logs;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-running service mode: scans the log file and replaces the stored address lists on a fixed interval until
 * the process is interrupted.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String MODE = "run";
  private static final Set<String> FLAGS = Set.of("--dry-run");
  private static final long SHUTDOWN_GRACE_MILLIS = 5_000;
  private static final AtomicBoolean SHUTDOWN_REQUESTED = new AtomicBoolean();
  static final String SUMMARY_USAGE =
      "usage: ipscan run [config=PATH] [filePath=PATH] [storeConnectionURI=URI] [databaseName=NAME] "
          + "[privateCollectionName=NAME] [publicCollectionName=NAME] [runIntervalSeconds=N] "
          + "[chunkSizeBytes=N] [workers=N] [metricsExporter=otlp|none] [--dry-run]";
  private static final String HELP_TEXT = """
      ipscan run: periodic log scan

      Usage:
        ipscan run [options]

      Options (CLI > YAML > environment > defaults):
        config=PATH                 YAML file with common/run sections (env IPSCAN_CONFIG)
        filePath=PATH               Log file to scan (env LOG_FILE_PATH, default data/access.log)
        storeConnectionURI=URI      mongodb:// or mongodb+srv:// URI (env MONGODB_URI)
        databaseName=NAME           Database name (env DATABASE_NAME, default ip_extraction)
        privateCollectionName=NAME  Collection for private addresses (env PRIVATE_COLLECTION_NAME)
        publicCollectionName=NAME   Collection for public addresses (env PUBLIC_COLLECTION_NAME)
        runIntervalSeconds=N        Sleep between cycles (env RUN_INTERVAL_SECONDS, default 10)
        chunkSizeBytes=N            Read size per chunk (default 1048576)
        workers=N                   Scan threads (default: available processors)
        metricsExporter=otlp|none   Metrics exporter (default none)
        otelEndpoint=URL            OTLP endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run                   Print the resolved plan and exit
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Notes:
        Cycle failures are logged and the loop continues; stop with SIGINT or SIGTERM.
      """;

  private RunCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    exitUnlessShuttingDown(exit);
  }

  /**
   * Terminates the JVM with {@code exit}, unless a termination signal already started the shutdown sequence.
   *
   * <p>{@link System#exit(int)} blocks forever once shutdown hooks are running, so after SIGINT or SIGTERM the main
   * thread simply returns and the JVM exits with the signal status (130 or 143).</p>
   *
   * @param exit exit code for a normal termination
   */
  static void exitUnlessShuttingDown(ExitCode exit) {
    if (shutdownRequested()) {
      log.info("Shutdown signal received; leaving exit status to the JVM (would have been {})", exit.code());
      return;
    }
    System.exit(exit.code());
  }

  static boolean shutdownRequested() {
    return SHUTDOWN_REQUESTED.get();
  }

  static void clearShutdownForTesting() {
    SHUTDOWN_REQUESTED.set(false);
  }

  static ExitCode run(String[] args) {
    return run(args, System.getenv());
  }

  static ExitCode run(String[] args, Map<String, String> environment) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run CLI");
    }
    List<String> unsupported = input.unsupportedFlags(FLAGS);
    if (!unsupported.isEmpty()) {
      log.error("Unsupported flag(s): {}", unsupported);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ScanCliSupport.Resolution resolution =
        ScanCliSupport.resolve(MODE, input, environment, SUMMARY_USAGE, log);
    if (!resolution.ok()) {
      return resolution.failure();
    }
    ScanConfig config = resolution.config();
    if (input.hasFlag("--dry-run")) {
      ScanCliSupport.printDryRunPlan(MODE, config, resolution.exporter(), true);
      return ExitCode.SUCCESS;
    }

    MetricsPort metrics = ScanCliSupport.metricsFor(resolution.exporter());
    Thread mainThread = Thread.currentThread();
    Thread shutdownHook = new Thread(() -> stopAndAwait(mainThread), "ipscan-shutdown");
    Runtime.getRuntime().addShutdownHook(shutdownHook);
    try {
      CompositionRoot root = new CompositionRoot(config, metrics);
      ScanCycleUseCase cycle = root.scanCycle(root.mongoConnector());
      log.info(
          "Starting scan service: file={}, store={}, database={}, collections={}/{}, interval={}s",
          config.filePath(),
          Logs.redactUri(config.storeConnectionURI()),
          config.databaseName(),
          config.privateCollectionName(),
          config.publicCollectionName(),
          config.runInterval().toSeconds());
      long cycles = root.runLoop().runForever(config.runInterval(), cycle::runOnce);
      log.info("Scan service stopped after {} cycle(s)", cycles);
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("Scan service configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in scan service", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      removeHook(shutdownHook);
      ScanCliSupport.closeMetrics(metrics, log);
    }
  }

  static void stopAndAwait(Thread worker) {
    SHUTDOWN_REQUESTED.set(true);
    worker.interrupt();
    try {
      worker.join(SHUTDOWN_GRACE_MILLIS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook left in place");
    }
  }
}
