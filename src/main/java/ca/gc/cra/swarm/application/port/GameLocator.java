package ca.gc.cra.swarm.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Finds the game a given player is currently seated in.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface GameLocator {
  /**
   * Looks up the current game of {@code playerId}.
   *
   * @param playerId player to search for
   * @return game identifier, or empty when the player is not in any listed game
   * @throws IOException when the game listing cannot be fetched or parsed
   * @throws InterruptedException when interrupted while waiting for the listing
   */
  Optional<String> locate(String playerId) throws IOException, InterruptedException;
}
