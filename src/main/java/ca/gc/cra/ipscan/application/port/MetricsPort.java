package ca.gc.cra.ipscan.application.port;

/**
 * <strong>What:</strong> Domain port abstracting metrics emission.
 * <p><strong>Why:</strong> Lets the extraction pipeline and scan cycle record counters and latencies without binding to
 * a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates from scan workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code scan.run.latencyNanos}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code cycle.success}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (nanoseconds, bytes, counts) as defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
