package ca.gc.cra.swarm.application.soak;

import ca.gc.cra.swarm.application.port.GameLocator;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls a {@link GameLocator} until the target player shows up in a game or the attempts run out.
 *
 * <p>A failed lookup counts as an attempt and is retried like a miss.</p>
 *
 * @since 0.1.0
 */
public final class GameSearch {
  private static final Logger log = LoggerFactory.getLogger(GameSearch.class);

  private final GameLocator locator;
  private final int attempts;
  private final Duration retryDelay;

  /**
   * Creates a search.
   *
   * @param locator game lookup
   * @param attempts maximum number of lookups; must be positive
   * @param retryDelay pause between lookups
   */
  public GameSearch(GameLocator locator, int attempts, Duration retryDelay) {
    this.locator = Objects.requireNonNull(locator, "locator");
    if (attempts <= 0) {
      throw new IllegalArgumentException("attempts must be positive");
    }
    this.attempts = attempts;
    this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
  }

  /**
   * Looks for the game of {@code playerId}.
   *
   * @param playerId player to find
   * @return game id, or empty when every attempt missed
   * @throws InterruptedException when interrupted between or during lookups
   */
  public Optional<String> find(String playerId) throws InterruptedException {
    Objects.requireNonNull(playerId, "playerId");
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        Optional<String> gameId = locator.locate(playerId);
        if (gameId.isPresent()) {
          log.info("Found player {} in game {}", playerId, gameId.get());
          return gameId;
        }
        log.info("Player {} not found in current game list (attempt {}/{})", playerId, attempt, attempts);
      } catch (IOException ex) {
        log.warn("Attempt {}/{} to find the game of player {} failed: {}", attempt, attempts, playerId,
            ex.getMessage());
      }
      if (attempt < attempts && !retryDelay.isZero()) {
        Thread.sleep(retryDelay.toMillis());
      }
    }
    return Optional.empty();
  }
}
