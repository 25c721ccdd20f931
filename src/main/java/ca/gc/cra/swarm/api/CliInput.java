package ca.gc.cra.swarm.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw command-line arguments into positional words, {@code key=value} options and flags.
 *
 * <p>Flags start with {@code -} and carry no {@code =}. {@code --help}/{@code -h}/{@code help} and
 * {@code --verbose}/{@code -v}/{@code --debug} are normalized to their long forms.</p>
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> positional;
  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> positional, String[] keyValueArgs, Set<String> flags) {
    this.positional = positional;
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Parses arguments; blank and {@code null} entries are skipped.
   *
   * @param args raw arguments, possibly {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> positional = new ArrayList<>();
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else if (arg.contains("=")) {
        kv.add(arg);
      } else {
        positional.add(arg);
      }
    }
    return new CliInput(List.copyOf(positional), kv.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Returns the first positional word, lower-cased.
   *
   * @return command name, or empty string when none was given
   */
  public String command() {
    return positional.isEmpty() ? "" : positional.get(0).toLowerCase(Locale.ROOT);
  }

  /**
   * Returns every argument except the command, with flags restored, for a subcommand to parse again. Extra
   * positional words are kept so the subcommand can reject them.
   *
   * @return arguments after the command
   */
  public String[] subcommandArgs() {
    List<String> rest = new ArrayList<>(positional.subList(Math.min(1, positional.size()), positional.size()));
    rest.addAll(Arrays.asList(keyValueArgs));
    rest.addAll(flags);
    return rest.toArray(String[]::new);
  }

  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Indicates whether {@code flag} was given.
   *
   * @param flag flag including its dashes, case-insensitive
   * @return {@code true} when present
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
