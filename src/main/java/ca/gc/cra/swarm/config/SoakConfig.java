package ca.gc.cra.swarm.config;

import ca.gc.cra.swarm.validation.Net;
import ca.gc.cra.swarm.validation.Numbers;
import ca.gc.cra.swarm.validation.Strings;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable configuration of the {@code soak} mode.
 *
 * <p>The target is, in order of preference, {@code targetUrl}, {@code baseUrl/games/gameId}, or the game found
 * by searching the games listing for {@code targetPlayer}.</p>
 *
 * @param baseUrl API base URL
 * @param targetUrl explicit URL to request
 * @param gameId game whose page is requested
 * @param targetPlayer player whose current game is looked up
 * @param workers number of concurrent workers
 * @param duration how long workers keep sending
 * @param requestTimeout per-request timeout
 * @param failureBackoff pause after a transport error
 * @param locateAttempts maximum games listing lookups
 * @param locateRetryDelay pause between lookups
 * @since 0.1.0
 */
public record SoakConfig(
    URI baseUrl,
    Optional<URI> targetUrl,
    Optional<String> gameId,
    Optional<String> targetPlayer,
    int workers,
    Duration duration,
    Duration requestTimeout,
    Duration failureBackoff,
    int locateAttempts,
    Duration locateRetryDelay) {

  private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final int MAX_WORKERS = 100_000;
  private static final long MAX_DURATION_SECONDS = 86_400L;
  private static final long MAX_TIMEOUT_MS = 600_000L;
  private static final int MAX_LOCATE_ATTEMPTS = 10_000;

  public SoakConfig {
    Objects.requireNonNull(baseUrl, "baseUrl");
    targetUrl = Objects.requireNonNullElse(targetUrl, Optional.empty());
    gameId = Objects.requireNonNullElse(gameId, Optional.<String>empty()).map(SoakConfig::requireId);
    targetPlayer = Objects.requireNonNullElse(targetPlayer, Optional.empty());
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    Numbers.requireRange("durationSeconds", Objects.requireNonNull(duration, "duration").toSeconds(),
        1, MAX_DURATION_SECONDS);
    Numbers.requireRange("requestTimeoutMs", Objects.requireNonNull(requestTimeout, "requestTimeout").toMillis(),
        1, MAX_TIMEOUT_MS);
    Numbers.requireRange("failureBackoffMs", Objects.requireNonNull(failureBackoff, "failureBackoff").toMillis(),
        0, MAX_TIMEOUT_MS);
    Numbers.requireRange("locateAttempts", locateAttempts, 1, MAX_LOCATE_ATTEMPTS);
    Numbers.requireRange("locateRetryDelayMs",
        Objects.requireNonNull(locateRetryDelay, "locateRetryDelay").toMillis(), 0, MAX_TIMEOUT_MS);
  }

  /**
   * Returns the built-in defaults; no target is set.
   *
   * @return default configuration
   */
  public static SoakConfig defaults() {
    return new SoakConfig(
        URI.create("http://localhost:8082"),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        50,
        Duration.ofSeconds(30),
        Duration.ofSeconds(10),
        Duration.ofMillis(50),
        100,
        Duration.ofSeconds(1));
  }

  /**
   * Builds a configuration from flattened key/value options.
   *
   * @param options merged options
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed, or when no target can be derived
   */
  public static SoakConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SoakConfig defaults = defaults();

    URI baseUrl = optional(options, "baseUrl")
        .map(raw -> Net.validateHttpUrl("baseUrl", raw))
        .orElse(defaults.baseUrl());
    Optional<URI> targetUrl = optional(options, "targetUrl").map(raw -> Net.validateHttpUrl("targetUrl", raw));
    Optional<String> gameId = optional(options, "gameId");
    Optional<String> targetPlayer = optional(options, "targetPlayer")
        .map(raw -> Strings.requirePrintableAscii("targetPlayer", raw, 256));
    if (targetUrl.isEmpty() && gameId.isEmpty() && targetPlayer.isEmpty()) {
      throw new IllegalArgumentException("soak needs one of targetUrl, gameId or targetPlayer");
    }

    return new SoakConfig(
        baseUrl,
        targetUrl,
        gameId,
        targetPlayer,
        (int) longOption(options, "workers", defaults.workers(), 1, MAX_WORKERS),
        Duration.ofSeconds(
            longOption(options, "durationSeconds", defaults.duration().toSeconds(), 1, MAX_DURATION_SECONDS)),
        Duration.ofMillis(
            longOption(options, "requestTimeoutMs", defaults.requestTimeout().toMillis(), 1, MAX_TIMEOUT_MS)),
        Duration.ofMillis(
            longOption(options, "failureBackoffMs", defaults.failureBackoff().toMillis(), 0, MAX_TIMEOUT_MS)),
        (int) longOption(options, "locateAttempts", defaults.locateAttempts(), 1, MAX_LOCATE_ATTEMPTS),
        Duration.ofMillis(longOption(
            options, "locateRetryDelayMs", defaults.locateRetryDelay().toMillis(), 0, MAX_TIMEOUT_MS)));
  }

  /**
   * Returns the target when it is known without searching the games listing.
   *
   * @return {@code targetUrl}, else the page of {@code gameId}, else empty
   */
  public Optional<URI> fixedTarget() {
    if (targetUrl.isPresent()) {
      return targetUrl;
    }
    return gameId.map(this::gameUrl);
  }

  /**
   * Builds the page URL of a game.
   *
   * @param id game identifier
   * @return {@code baseUrl/games/id}
   */
  public URI gameUrl(String id) {
    String base = baseUrl.toString();
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + "/games/" + requireId(id));
  }

  private static String requireId(String id) {
    String trimmed = Strings.requireNonBlank("gameId", id);
    if (!ID_PATTERN.matcher(trimmed).matches()) {
      throw new IllegalArgumentException("gameId must only contain letters, digits, dot, underscore, or hyphen");
    }
    return trimmed;
  }

  private static Optional<String> optional(Map<String, String> options, String key) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(raw.trim());
  }

  private static long longOption(Map<String, String> options, String key, long fallback, long min, long max) {
    return optional(options, key).map(raw -> Numbers.parseInRange(key, raw, min, max)).orElse(fallback);
  }
}
