package ca.gc.cra.ipscan.api;

import java.util.Map;

/**
 * Helpers for pulling CLI-only options out of the key/value map before it is merged with YAML and defaults.
 */
final class ConfigCliUtils {
  static final String CONFIG_ENV_VARIABLE = "IPSCAN_CONFIG";

  private ConfigCliUtils() {}

  /**
   * Removes {@code config=PATH} from the CLI map, falling back to {@code IPSCAN_CONFIG}.
   *
   * @param args mutable CLI map; the config key is removed so it never reaches the merger
   * @param environment environment variables
   * @return configured YAML path, or {@code null} when none was given
   */
  static String extractConfigPath(Map<String, String> args, Map<String, String> environment) {
    if (args != null) {
      String value = args.remove("config");
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    if (environment != null) {
      String fromEnv = environment.get(CONFIG_ENV_VARIABLE);
      if (fromEnv != null && !fromEnv.isBlank()) {
        return fromEnv.trim();
      }
    }
    return null;
  }
}
