package ca.gc.cra.ipscan.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Translates container environment variables into configuration keys.
 *
 * <p>Recognized variables: {@code MONGODB_URI}, {@code DATABASE_NAME}, {@code PRIVATE_COLLECTION_NAME},
 * {@code PUBLIC_COLLECTION_NAME}, {@code LOG_FILE_PATH} and {@code RUN_INTERVAL_SECONDS}. Blank values are treated as
 * absent.</p>
 */
public final class EnvironmentConfig {
  private static final Map<String, String> VARIABLES = Map.of(
      "MONGODB_URI", "storeConnectionURI",
      "DATABASE_NAME", "databaseName",
      "PRIVATE_COLLECTION_NAME", "privateCollectionName",
      "PUBLIC_COLLECTION_NAME", "publicCollectionName",
      "LOG_FILE_PATH", "filePath",
      "RUN_INTERVAL_SECONDS", "runIntervalSeconds");

  private EnvironmentConfig() {}

  /**
   * Reads the process environment.
   *
   * @return configuration keys set by the environment
   */
  public static Map<String, String> fromSystem() {
    return from(System::getenv);
  }

  /**
   * Reads variables through the supplied lookup.
   *
   * @param lookup variable name to value; returns {@code null} when unset
   * @return immutable map of configuration keys to trimmed values
   */
  public static Map<String, String> from(UnaryOperator<String> lookup) {
    Objects.requireNonNull(lookup, "lookup");
    Map<String, String> result = new LinkedHashMap<>();
    VARIABLES.forEach((variable, key) -> {
      String value = lookup.apply(variable);
      if (value != null && !value.isBlank()) {
        result.put(key, value.trim());
      }
    });
    return Map.copyOf(result);
  }
}
