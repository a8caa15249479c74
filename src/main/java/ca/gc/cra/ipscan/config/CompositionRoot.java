package ca.gc.cra.ipscan.config;

import ca.gc.cra.ipscan.adapter.mongo.MongoResultStoreConnector;
import ca.gc.cra.ipscan.application.pipeline.ExtractionPipeline;
import ca.gc.cra.ipscan.application.pipeline.RunLoop;
import ca.gc.cra.ipscan.application.pipeline.ScanCycleUseCase;
import ca.gc.cra.ipscan.application.port.MetricsPort;
import ca.gc.cra.ipscan.application.port.ResultStoreConnector;
import ca.gc.cra.ipscan.domain.address.AddressClassifier;
import ca.gc.cra.ipscan.domain.address.ChunkScanner;
import ca.gc.cra.ipscan.domain.address.ClassificationRules;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the scan cycle and run loop to concrete adapters.
 * <p><strong>Why:</strong> Keeps construction in one place so the CLI only decides which store to use.</p>
 * <p><strong>Role:</strong> Composition root spanning extraction, classification and persistence.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods allocate new graphs and are not
 * synchronized.</p>
 *
 * @implNote The scanner pattern and classification rules are built once here and shared by every cycle.
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final ScanConfig config;
  private final MetricsPort metrics;
  private final ChunkScanner scanner;
  private final AddressClassifier classifier;

  /**
   * Creates a root with default classification rules.
   *
   * @param config validated scan configuration
   * @param metrics metrics sink shared by all components
   */
  public CompositionRoot(ScanConfig config, MetricsPort metrics) {
    this(config, metrics, ClassificationRules.defaults());
  }

  /**
   * Creates a root with explicit classification rules.
   *
   * @param config validated scan configuration
   * @param metrics metrics sink shared by all components
   * @param rules private and excluded range tables
   */
  public CompositionRoot(ScanConfig config, MetricsPort metrics, ClassificationRules rules) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.scanner = new ChunkScanner(ChunkScanner.defaultPattern());
    this.classifier = new AddressClassifier(Objects.requireNonNull(rules, "rules"));
  }

  /**
   * Builds the extraction pipeline for the configured chunk size and worker count.
   *
   * @return new pipeline
   */
  public ExtractionPipeline extractionPipeline() {
    return new ExtractionPipeline(
        scanner, classifier, config.chunkSizeBytes(), config.workers(), metrics);
  }

  /**
   * Builds a MongoDB connector for the configured deployment and collections.
   *
   * @return new connector
   */
  public ResultStoreConnector mongoConnector() {
    return new MongoResultStoreConnector(
        config.storeConnectionURI(),
        config.databaseName(),
        config.privateCollectionName(),
        config.publicCollectionName(),
        metrics);
  }

  /**
   * Builds a scan cycle writing through the supplied connector.
   *
   * @param connector result store connector
   * @return new cycle use case
   */
  public ScanCycleUseCase scanCycle(ResultStoreConnector connector) {
    return new ScanCycleUseCase(connector, extractionPipeline(), config.filePath(), metrics);
  }

  /**
   * Builds the fixed-interval run loop.
   *
   * @return new run loop
   */
  public RunLoop runLoop() {
    return new RunLoop();
  }

  /**
   * Returns the configuration this root was built with.
   *
   * @return scan configuration
   */
  public ScanConfig config() {
    return config;
  }
}
