package ca.gc.cra.ipscan.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, the environment, YAML and CLI sources.
 *
 * <p>Precedence, highest first: CLI, YAML, environment, defaults. Every key must be one the mode defines; a
 * misspelled CLI key fails fast while a misspelled YAML key only warns, so one shared file can serve several
 * modes.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param mode active CLI mode
   * @param environment settings derived from environment variables (may be empty)
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode; the key set defines the accepted options
   * @param warn consumer invoked for overrides and ignored keys
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when the CLI names an unknown key
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Map<String, String> environment,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> envCopy = environment == null ? Map.of() : environment;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> warnings = warn == null ? message -> {} : warn;

    for (String key : cliCopy.keySet()) {
      if (!defaultsCopy.containsKey(key)) {
        throw new IllegalArgumentException("Unknown option for " + mode + ": " + key);
      }
    }

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    overlay(merged, envCopy, defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      if (!defaultsCopy.containsKey(entry.getKey())) {
        warnings.accept("Ignoring unknown YAML key for " + mode + ": " + entry.getKey());
        continue;
      }
      if (envCopy.containsKey(entry.getKey())) {
        warnings.accept("YAML overrides environment for key: " + entry.getKey());
      }
      if (entry.getValue() != null) {
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      if (yamlCopy.containsKey(entry.getKey())) {
        warnings.accept("CLI overrides YAML for key: " + entry.getKey());
      }
      if (entry.getValue() != null) {
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    return Map.copyOf(merged);
  }

  private static void overlay(
      Map<String, String> merged, Map<String, String> source, Map<String, String> allowed) {
    for (Map.Entry<String, String> entry : source.entrySet()) {
      if (allowed.containsKey(entry.getKey()) && entry.getValue() != null) {
        merged.put(entry.getKey(), entry.getValue());
      }
    }
  }
}
