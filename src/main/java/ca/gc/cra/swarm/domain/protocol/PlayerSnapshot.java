package ca.gc.cra.swarm.domain.protocol;

import java.util.Objects;

/**
 * Acting player's state embedded in a betting turn.
 *
 * @param playerId player identifier; empty when absent from the message
 * @param chips current chip stack; zero when absent
 * @since 0.1.0
 */
public record PlayerSnapshot(String playerId, long chips) {
  /** Snapshot used when the message carries no player state. */
  public static final PlayerSnapshot EMPTY = new PlayerSnapshot("", 0L);

  public PlayerSnapshot {
    playerId = Objects.requireNonNullElse(playerId, "");
  }
}
