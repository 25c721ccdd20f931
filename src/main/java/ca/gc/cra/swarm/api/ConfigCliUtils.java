package ca.gc.cra.swarm.api;

import ca.gc.cra.swarm.config.ConfigMerger;
import ca.gc.cra.swarm.config.DefaultsForMode;
import ca.gc.cra.swarm.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared CLI plumbing: extracts {@code config=PATH}, loads YAML and merges it with defaults and CLI options.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Effective options of a command, or the exit code to return when they could not be built.
   *
   * @param effective merged options; empty when {@code failure} is set
   * @param failure exit code for a failed load; {@code null} on success
   */
  record Loaded(Map<String, String> effective, ExitCode failure) {
    boolean ok() {
      return failure == null;
    }
  }

  /**
   * Builds the effective options of {@code mode} with precedence CLI > YAML > defaults.
   *
   * @param mode command name
   * @param input parsed command line
   * @param usage usage line printed on invalid input
   * @param log logger of the calling command
   * @return merged options or the failure exit code
   */
  static Loaded loadEffectiveConfig(String mode, CliInput input, String usage, Logger log) {
    if (!input.command().isEmpty()) {
      log.error("Unexpected argument: {}", input.command());
      CliPrinter.println(usage);
      return new Loaded(Map.of(), ExitCode.INVALID_ARGS);
    }
    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return new Loaded(Map.of(), ExitCode.INVALID_ARGS);
    }

    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return new Loaded(Map.of(), ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        return new Loaded(Map.of(), ExitCode.INVALID_ARGS);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return new Loaded(Map.of(), ExitCode.IO_ERROR);
      }
    }

    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      return new Loaded(effective, null);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return new Loaded(Map.of(), ExitCode.INVALID_ARGS);
    }
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    String value = map == null ? null : map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
