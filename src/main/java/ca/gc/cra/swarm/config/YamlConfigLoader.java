package ca.gc.cra.swarm.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the per-command settings of a SWARM YAML file.
 *
 * <p>The top level may only hold the sections {@code common}, {@code play}, {@code register} and {@code soak}.
 * Each section maps setting names to scalars. {@code common} applies to every command and the command's own
 * section overrides it; the other command sections are checked but ignored. An empty value means "unset".</p>
 */
public final class YamlConfigLoader {
  static final String COMMON = "common";
  static final List<String> COMMANDS = List.of("play", "register", "soak");

  private YamlConfigLoader() {}

  /**
   * Returns the settings of {@code command}, layered over the common section.
   *
   * @param path location of the YAML file
   * @param command one of {@code play}, {@code register} or {@code soak}
   * @return settings keyed by name, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the command is unknown or the file is not a valid SWARM config
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    String wanted = sectionName(Objects.requireNonNull(command, "command"));
    if (!COMMANDS.contains(wanted)) {
      throw new IllegalArgumentException("No YAML section for command '" + command + "'");
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> sections)) {
      throw new IllegalArgumentException(path + " must map section names to settings");
    }

    Map<String, String> common = Map.of();
    Map<String, String> own = Map.of();
    for (Map.Entry<?, ?> section : sections.entrySet()) {
      String name = sectionName(String.valueOf(section.getKey()));
      if (!COMMON.equals(name) && !COMMANDS.contains(name)) {
        throw new IllegalArgumentException("Unknown YAML section '" + section.getKey()
            + "'; expected common, play, register or soak");
      }
      Map<String, String> settings = settings(name, section.getValue());
      if (COMMON.equals(name)) {
        common = settings;
      } else if (name.equals(wanted)) {
        own = settings;
      }
    }

    Map<String, String> merged = new LinkedHashMap<>(common);
    merged.putAll(own);
    return Optional.of(Map.copyOf(merged));
  }

  private static String sectionName(String raw) {
    return raw.trim().toLowerCase(Locale.ROOT);
  }

  private static Map<String, String> settings(String section, Object body) {
    if (body == null) {
      return Map.of();
    }
    if (!(body instanceof Map<?, ?> entries)) {
      throw new IllegalArgumentException("YAML section '" + section + "' must be a mapping");
    }
    Map<String, String> settings = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException("YAML section '" + section + "' has a blank or non-string key");
      }
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException(section + "." + key + " must be a single value");
      }
      settings.put(key.trim(), value == null ? "" : value.toString());
    }
    return settings;
  }
}
