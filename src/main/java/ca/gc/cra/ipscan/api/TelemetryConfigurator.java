package ca.gc.cra.ipscan.api;

import ca.gc.cra.ipscan.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the telemetry options out of the effective configuration and into the system properties read by the
 * OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  static final String EXPORTER_NONE = "none";
  static final String EXPORTER_OTLP = "otlp";

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from {@code options}.
   *
   * @param options mutable effective configuration
   * @return normalized exporter name, {@code none} when unset
   * @throws IllegalArgumentException when a telemetry option is malformed
   */
  static String configureMetrics(Map<String, String> options) {
    String exporter = normalizeExporter(options.remove("metricsExporter"));
    String endpoint = trimToNull(options.remove("otelEndpoint"));
    String attributes = trimToNull(options.remove("otelResourceAttributes"));

    System.setProperty("otel.metrics.exporter", exporter);
    if (endpoint != null) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }
    if (attributes != null) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", attributes);
    }
    log.debug("Metrics exporter set to {}", exporter);
    return exporter;
  }

  private static String normalizeExporter(String raw) {
    String value = trimToNull(raw);
    if (value == null) {
      return EXPORTER_NONE;
    }
    String normalized = value.toLowerCase(Locale.ROOT);
    if (!normalized.equals(EXPORTER_OTLP) && !normalized.equals(EXPORTER_NONE)) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return normalized;
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
