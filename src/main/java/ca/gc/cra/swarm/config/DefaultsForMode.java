package ca.gc.cra.swarm.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each SWARM command.
 *
 * <p>The values mirror {@link SessionConfig#defaults()} and {@link SoakConfig#defaults()} so a dry run can
 * print every effective key.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target command (play, register, soak)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "play", "register" -> buildSessionDefaults();
      case "soak" -> buildSoakDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildSessionDefaults() {
    SessionConfig defaults = SessionConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("server", defaults.serverLabel());
    map.put("players", Long.toString(defaults.players()));
    map.put("concurrency", Integer.toString(defaults.concurrency()));
    map.put("usernamePrefix", defaults.usernamePrefix());
    map.put("passwordPrefix", defaults.passwordPrefix());
    map.put("firstId", Long.toString(defaults.firstId()));
    map.put("connectTimeoutMs", Long.toString(defaults.connectTimeout().toMillis()));
    map.put("ioTimeoutMs", Long.toString(defaults.ioTimeout().toMillis()));
    map.put("activityTimeoutMs", Long.toString(defaults.activityTimeout().toMillis()));
    map.put("maxLineBytes", Integer.toString(defaults.maxLineBytes()));
    map.put("progressEvery", Long.toString(defaults.progressEvery()));
    map.put("startDelayMs", Long.toString(defaults.startDelay().toMillis()));
    return map;
  }

  private static Map<String, String> buildSoakDefaults() {
    SoakConfig defaults = SoakConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("baseUrl", defaults.baseUrl().toString());
    map.put("targetUrl", "");
    map.put("gameId", "");
    map.put("targetPlayer", "");
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("durationSeconds", Long.toString(defaults.duration().toSeconds()));
    map.put("requestTimeoutMs", Long.toString(defaults.requestTimeout().toMillis()));
    map.put("failureBackoffMs", Long.toString(defaults.failureBackoff().toMillis()));
    map.put("locateAttempts", Integer.toString(defaults.locateAttempts()));
    map.put("locateRetryDelayMs", Long.toString(defaults.locateRetryDelay().toMillis()));
    return map;
  }
}
