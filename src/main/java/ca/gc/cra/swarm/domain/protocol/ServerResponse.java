package ca.gc.cra.swarm.domain.protocol;

import java.util.Objects;

/**
 * Decoded server message. Every field absent from the wire holds its zero value.
 *
 * @param type event name; empty when absent
 * @param eventJson raw JSON text of the {@code event} payload; empty when absent
 * @param code error code; {@code 0} means no error
 * @param message error or informational message; empty when absent
 * @param gameId game identifier; empty when absent
 * @param stage betting stage of a betting turn; empty when absent
 * @param player acting player of a betting turn; {@link PlayerSnapshot#EMPTY} when absent
 * @param minimumBet minimum bet of a betting turn; zero when absent
 * @since 0.1.0
 */
public record ServerResponse(
    String type,
    String eventJson,
    long code,
    String message,
    String gameId,
    String stage,
    PlayerSnapshot player,
    long minimumBet) {

  /** Message with every field at its zero value. */
  public static final ServerResponse EMPTY =
      new ServerResponse("", "", 0L, "", "", "", PlayerSnapshot.EMPTY, 0L);

  public ServerResponse {
    type = Objects.requireNonNullElse(type, "");
    eventJson = Objects.requireNonNullElse(eventJson, "");
    message = Objects.requireNonNullElse(message, "");
    gameId = Objects.requireNonNullElse(gameId, "");
    stage = Objects.requireNonNullElse(stage, "");
    player = Objects.requireNonNullElse(player, PlayerSnapshot.EMPTY);
  }

  /**
   * Classifies this message.
   *
   * @return response kind
   */
  public ResponseKind kind() {
    if (type.isEmpty()) {
      return code != 0 ? ResponseKind.BARE_ERROR : ResponseKind.AMBIGUOUS;
    }
    return switch (type) {
      case EventTypes.LEADERBOARD_ENTRY_START -> ResponseKind.REGISTERED;
      case EventTypes.PLAYER_BET -> ResponseKind.BET_TURN;
      case EventTypes.GAME_OVER, EventTypes.LEADERBOARD_ENTRY_END -> ResponseKind.TERMINAL;
      default -> ResponseKind.OTHER;
    };
  }

  /**
   * Indicates whether this message is a betting turn addressed to {@code username}.
   *
   * @param username session username
   * @return {@code true} when the embedded player id equals {@code username}
   */
  public boolean isTurnFor(String username) {
    return kind() == ResponseKind.BET_TURN && player.playerId().equals(username);
  }
}
