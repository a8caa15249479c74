package ca.gc.cra.ipscan.api;

import ca.gc.cra.ipscan.application.port.MetricsPort;
import ca.gc.cra.ipscan.config.ConfigMerger;
import ca.gc.cra.ipscan.config.DefaultsForMode;
import ca.gc.cra.ipscan.config.EnvironmentConfig;
import ca.gc.cra.ipscan.config.ScanConfig;
import ca.gc.cra.ipscan.config.YamlConfigLoader;
import ca.gc.cra.ipscan.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.ipscan.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.ipscan.logging.Logs;
import ca.gc.cra.ipscan.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Configuration resolution and dry-run output shared by the {@code run} and {@code scan} commands.
 */
final class ScanCliSupport {
  private ScanCliSupport() {
    // Utility class
  }

  /**
   * Resolves the effective configuration from defaults, environment, YAML and CLI.
   *
   * <p>Failures are logged and the usage line printed; the returned outcome then carries the exit code.</p>
   */
  static Resolution resolve(
      String mode, CliInput input, Map<String, String> environment, String usage, Logger log) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv, environment);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolution.failed(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    String exporter;
    ScanConfig config;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          mode,
          EnvironmentConfig.from(environment::get),
          yaml,
          kv,
          DefaultsForMode.asFlatMap(mode),
          log::warn));
      exporter = TelemetryConfigurator.configureMetrics(effective);
      config = ScanConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
    return new Resolution(config, exporter, null);
  }

  static MetricsPort metricsFor(String exporter) {
    if (TelemetryConfigurator.EXPORTER_OTLP.equals(exporter)) {
      return new OpenTelemetryMetricsAdapter();
    }
    return new NoOpMetricsAdapter();
  }

  static void closeMetrics(MetricsPort metrics, Logger log) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  static void printDryRunPlan(String mode, ScanConfig config, String exporter, boolean storeEnabled) {
    CliPrinter.printLines(
        "ipscan " + mode + " dry-run: nothing will be scanned or written.",
        " Log file          : " + config.filePath() + " (" + Paths.describeInputFile(config.filePath()) + ")",
        " Chunk size (bytes): " + config.chunkSizeBytes(),
        " Workers           : " + config.workers(),
        " Store             : " + (storeEnabled ? Logs.redactUri(config.storeConnectionURI()) : "<in-memory>"),
        " Database          : " + config.databaseName(),
        " Private collection: " + config.privateCollectionName(),
        " Public collection : " + config.publicCollectionName(),
        " Run interval      : " + ("run".equals(mode) ? config.runInterval().toSeconds() + "s" : "<single cycle>"),
        " Metrics exporter  : " + exporter,
        " Re-run without --dry-run to start scanning.");
  }

  record Resolution(ScanConfig config, String exporter, ExitCode failure) {
    static Resolution failed(ExitCode code) {
      return new Resolution(null, null, code);
    }

    boolean ok() {
      return failure == null;
    }
  }
}
