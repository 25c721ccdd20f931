package ca.gc.cra.swarm.domain.protocol;

/**
 * Event names carried in the {@code type} field of server messages.
 *
 * @since 0.1.0
 */
public final class EventTypes {
  /** Sent in reply to a successful registration. */
  public static final String LEADERBOARD_ENTRY_START = "event_player_leaderboard_entry_start";
  /** Sent when the player leaves the leaderboard, usually after losing all chips. */
  public static final String LEADERBOARD_ENTRY_END = "event_player_leaderboard_entry_end";
  /** Betting turn; carries the acting player's snapshot. */
  public static final String PLAYER_BET = "action_player_bet";
  /** End of the game the player joined. */
  public static final String GAME_OVER = "event_game_over";
  /** A pot was awarded. */
  public static final String POT_WON = "event_pot_won";

  private EventTypes() {}
}
