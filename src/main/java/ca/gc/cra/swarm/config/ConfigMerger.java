package ca.gc.cra.swarm.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence.
 */
public final class ConfigMerger {
  private static final Set<String> SOAK_TARGET_KEYS = Set.of("targetUrl", "gameId", "targetPlayer");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * <p>Keys unknown to the mode's defaults are rejected so a misspelt option never silently falls back to its
   * default. In soak mode a target given on the command line replaces any target set in YAML, so the two
   * sources cannot combine into an ambiguous target.</p>
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when an unknown key is supplied
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    requireKnownKeys(mode, "YAML", yamlCopy, defaultsCopy);
    requireKnownKeys(mode, "argument", cliCopy, defaultsCopy);

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    if ("soak".equalsIgnoreCase(mode) && cliCopy.keySet().stream().anyMatch(SOAK_TARGET_KEYS::contains)) {
      for (String key : SOAK_TARGET_KEYS) {
        merged.put(key, "");
      }
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }
    return Map.copyOf(merged);
  }

  private static void requireKnownKeys(
      String mode, String source, Map<String, String> values, Map<String, String> defaults) {
    if (defaults.isEmpty()) {
      return;
    }
    for (String key : values.keySet()) {
      if (key != null && !defaults.containsKey(key)) {
        throw new IllegalArgumentException("Unknown " + source + " key for " + mode + ": " + key);
      }
    }
  }
}
