package ca.gc.cra.ipscan.api;

import ca.gc.cra.ipscan.application.port.MetricsPort;
import ca.gc.cra.ipscan.application.port.ResultStoreConnector;
import ca.gc.cra.ipscan.application.port.StoreWriteException;
import ca.gc.cra.ipscan.config.CompositionRoot;
import ca.gc.cra.ipscan.config.ScanConfig;
import ca.gc.cra.ipscan.domain.address.ExtractionResult;
import ca.gc.cra.ipscan.infrastructure.persistence.InMemoryResultStore;
import ca.gc.cra.ipscan.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot scan: runs a single cycle, prints the private and public counts and exits.
 *
 * @since 0.1.0
 */
public final class ScanCli {
  private static final Logger log = LoggerFactory.getLogger(ScanCli.class);
  private static final String MODE = "scan";
  private static final Set<String> FLAGS = Set.of("--dry-run", "--no-store", "--list");
  static final String SUMMARY_USAGE =
      "usage: ipscan scan [config=PATH] [filePath=PATH] [storeConnectionURI=URI] [databaseName=NAME] "
          + "[privateCollectionName=NAME] [publicCollectionName=NAME] [chunkSizeBytes=N] [workers=N] "
          + "[metricsExporter=otlp|none] [--no-store] [--list] [--dry-run]";
  private static final String HELP_TEXT = """
      ipscan scan: single scan cycle

      Usage:
        ipscan scan filePath=./access.log [options]

      Options (CLI > YAML > environment > defaults):
        config=PATH                 YAML file with common/scan sections (env IPSCAN_CONFIG)
        filePath=PATH               Log file to scan (env LOG_FILE_PATH)
        storeConnectionURI=URI      mongodb:// or mongodb+srv:// URI (env MONGODB_URI)
        databaseName=NAME           Database name (env DATABASE_NAME)
        privateCollectionName=NAME  Collection for private addresses
        publicCollectionName=NAME   Collection for public addresses
        chunkSizeBytes=N            Read size per chunk (default 1048576)
        workers=N                   Scan threads (default: available processors)
        metricsExporter=otlp|none   Metrics exporter (default none)
        --no-store                  Keep results in memory; MongoDB is never contacted
        --list                      Print every address, not only the counts
        --dry-run                   Print the resolved plan and exit
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private ScanCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
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
      log.debug("Verbose logging enabled for scan CLI");
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
    boolean storeEnabled = !input.hasFlag("--no-store");
    if (input.hasFlag("--dry-run")) {
      ScanCliSupport.printDryRunPlan(MODE, config, resolution.exporter(), storeEnabled);
      return ExitCode.SUCCESS;
    }

    MetricsPort metrics = ScanCliSupport.metricsFor(resolution.exporter());
    try {
      CompositionRoot root = new CompositionRoot(config, metrics);
      ResultStoreConnector connector = storeEnabled ? root.mongoConnector() : new InMemoryResultStore();
      Optional<ExtractionResult> result = root.scanCycle(connector).runOnce();
      if (result.isEmpty()) {
        if (Thread.currentThread().isInterrupted()) {
          return ExitCode.INTERRUPTED;
        }
        log.error("Scan of {} did not complete", config.filePath());
        return ExitCode.IO_ERROR;
      }
      CliPrinter.printLines(summary(result.get(), input.hasFlag("--list")));
      return ExitCode.SUCCESS;
    } catch (StoreWriteException ex) {
      log.error("Failed to store scan results: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Scan configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in scan", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      ScanCliSupport.closeMetrics(metrics, log);
    }
  }

  private static String[] summary(ExtractionResult result, boolean listAddresses) {
    List<String> lines = new ArrayList<>();
    lines.add("Private IPs: " + result.privateAddresses().size());
    if (listAddresses) {
      result.privateAddresses().forEach(address -> lines.add("  " + address));
    }
    lines.add("Public IPs: " + result.publicAddresses().size());
    if (listAddresses) {
      result.publicAddresses().forEach(address -> lines.add("  " + address));
    }
    return lines.toArray(String[]::new);
  }
}
