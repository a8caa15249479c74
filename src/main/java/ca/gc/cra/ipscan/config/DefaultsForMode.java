package ca.gc.cra.ipscan.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The key set doubles as the list of options a mode accepts from the command line.</p>
 */
public final class DefaultsForMode {
  /** Modes understood by {@link #asFlatMap(String)}. */
  public static final Set<String> MODES = Set.of("run", "scan");

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode.
   *
   * @param mode {@code run} or {@code scan}
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException when the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    if (!MODES.contains(normalized)) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    ScanConfig defaults = ScanConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("filePath", defaults.filePath().toString());
    map.put("chunkSizeBytes", Integer.toString(defaults.chunkSizeBytes()));
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("storeConnectionURI", defaults.storeConnectionURI());
    map.put("databaseName", defaults.databaseName());
    map.put("privateCollectionName", defaults.privateCollectionName());
    map.put("publicCollectionName", defaults.publicCollectionName());
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    if (normalized.equals("run")) {
      map.put("runIntervalSeconds", Long.toString(defaults.runInterval().toSeconds()));
    }
    return Map.copyOf(map);
  }
}
