package ca.gc.cra.ipscan.infrastructure.metrics;

import ca.gc.cra.ipscan.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations. Used for {@code --no-store} dry scans and when telemetry is off.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
