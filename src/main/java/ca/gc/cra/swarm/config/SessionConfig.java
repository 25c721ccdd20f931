package ca.gc.cra.swarm.config;

import ca.gc.cra.swarm.validation.Net;
import ca.gc.cra.swarm.validation.Numbers;
import ca.gc.cra.swarm.validation.Strings;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of the {@code play} and {@code register} modes.
 *
 * @param server game server endpoint, unresolved until the run starts
 * @param players number of sessions to launch
 * @param concurrency maximum number of simultaneously active sessions
 * @param usernamePrefix prefix of every generated username
 * @param passwordPrefix prefix of every generated password
 * @param firstId id of the first session; ids are sequential
 * @param connectTimeout TCP connect deadline
 * @param ioTimeout per read/write deadline
 * @param activityTimeout maximum time a session spends waiting for game events after joining
 * @param maxLineBytes upper bound on inbound line length
 * @param progressEvery launches between progress log lines; {@code 0} disables them
 * @param startDelay pause before the first launch
 * @since 0.1.0
 */
public record SessionConfig(
    InetSocketAddress server,
    long players,
    int concurrency,
    String usernamePrefix,
    String passwordPrefix,
    long firstId,
    Duration connectTimeout,
    Duration ioTimeout,
    Duration activityTimeout,
    int maxLineBytes,
    long progressEvery,
    Duration startDelay) {

  static final long MAX_PLAYERS = 100_000_000L;
  static final int MAX_CONCURRENCY = 10_000;
  static final int MAX_PREFIX_LENGTH = 64;
  private static final long MAX_IO_TIMEOUT_MS = 3_600_000L;
  private static final long MAX_ACTIVITY_TIMEOUT_MS = 86_400_000L;
  private static final int MIN_LINE_BYTES = 256;
  private static final int MAX_LINE_BYTES = 64 * 1024 * 1024;

  public SessionConfig {
    Objects.requireNonNull(server, "server");
    Numbers.requireRange("players", players, 1, MAX_PLAYERS);
    Numbers.requireRange("concurrency", concurrency, 1, MAX_CONCURRENCY);
    usernamePrefix = Strings.requirePrintableAscii("usernamePrefix", usernamePrefix, MAX_PREFIX_LENGTH);
    passwordPrefix = Strings.requirePrintableAscii("passwordPrefix", passwordPrefix, MAX_PREFIX_LENGTH);
    Numbers.requireRange("firstId", firstId, 0, Long.MAX_VALUE - players);
    requireMillis("connectTimeoutMs", connectTimeout, 1, MAX_IO_TIMEOUT_MS);
    requireMillis("ioTimeoutMs", ioTimeout, 1, MAX_IO_TIMEOUT_MS);
    requireMillis("activityTimeoutMs", activityTimeout, 1, MAX_ACTIVITY_TIMEOUT_MS);
    Numbers.requireRange("maxLineBytes", maxLineBytes, MIN_LINE_BYTES, MAX_LINE_BYTES);
    Numbers.requireRange("progressEvery", progressEvery, 0, Long.MAX_VALUE);
    requireMillis("startDelayMs", startDelay, 0, MAX_IO_TIMEOUT_MS);
  }

  /**
   * Returns the built-in defaults.
   *
   * @return default configuration
   */
  public static SessionConfig defaults() {
    return new SessionConfig(
        InetSocketAddress.createUnresolved("localhost", 8083),
        100L,
        100,
        "swarm-",
        "password",
        0L,
        Duration.ofSeconds(10),
        Duration.ofSeconds(10),
        Duration.ofSeconds(60),
        1024 * 1024,
        100L,
        Duration.ZERO);
  }

  /**
   * Builds a configuration from flattened key/value options, falling back to defaults for absent keys.
   *
   * @param options merged options
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static SessionConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SessionConfig defaults = defaults();

    String serverRaw = options.get("server");
    InetSocketAddress server =
        serverRaw == null || serverRaw.isBlank() ? defaults.server() : Net.parseHostPort(serverRaw);
    long players = longOption(options, "players", defaults.players(), 1, MAX_PLAYERS);
    int concurrency = (int) longOption(options, "concurrency", defaults.concurrency(), 1, MAX_CONCURRENCY);
    String usernamePrefix = options.getOrDefault("usernamePrefix", defaults.usernamePrefix());
    String passwordPrefix = options.getOrDefault("passwordPrefix", defaults.passwordPrefix());
    long firstId = longOption(options, "firstId", defaults.firstId(), 0, Long.MAX_VALUE);
    Duration connectTimeout = millisOption(options, "connectTimeoutMs", defaults.connectTimeout());
    Duration ioTimeout = millisOption(options, "ioTimeoutMs", defaults.ioTimeout());
    Duration activityTimeout = millisOption(options, "activityTimeoutMs", defaults.activityTimeout());
    int maxLineBytes =
        (int) longOption(options, "maxLineBytes", defaults.maxLineBytes(), MIN_LINE_BYTES, MAX_LINE_BYTES);
    long progressEvery = longOption(options, "progressEvery", defaults.progressEvery(), 0, Long.MAX_VALUE);
    Duration startDelay = millisOption(options, "startDelayMs", defaults.startDelay());

    return new SessionConfig(
        server,
        players,
        concurrency,
        usernamePrefix,
        passwordPrefix,
        firstId,
        connectTimeout,
        ioTimeout,
        activityTimeout,
        maxLineBytes,
        progressEvery,
        startDelay);
  }

  /**
   * Returns the server endpoint as {@code host:port}.
   *
   * @return printable endpoint
   */
  public String serverLabel() {
    String host = server.getHostString();
    return (host.indexOf(':') >= 0 ? '[' + host + ']' : host) + ':' + server.getPort();
  }

  private static long longOption(Map<String, String> options, String key, long fallback, long min, long max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseInRange(key, raw, min, max);
  }

  private static Duration millisOption(Map<String, String> options, String key, Duration fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Duration.ofMillis(Numbers.parseInRange(key, raw, 0, Long.MAX_VALUE / 1_000_000L));
  }

  private static void requireMillis(String name, Duration value, long min, long max) {
    Objects.requireNonNull(value, name);
    Numbers.requireRange(name, value.toMillis(), min, max);
  }
}
