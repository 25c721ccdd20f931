package ca.gc.cra.swarm.domain.protocol;

/**
 * Classification of a decoded server message as seen by a player session.
 *
 * @since 0.1.0
 */
public enum ResponseKind {
  /** Registration accepted. */
  REGISTERED,
  /** Betting turn for some player. */
  BET_TURN,
  /** Game over or leaderboard exit; the session ends. */
  TERMINAL,
  /** Empty type with a non-zero code. */
  BARE_ERROR,
  /** Empty type and zero code. */
  AMBIGUOUS,
  /** Any other event type. */
  OTHER
}
