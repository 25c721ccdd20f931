package ca.gc.cra.swarm.domain.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ServerResponseTest {

  @Test
  void emptyTypeIsClassifiedByCode() {
    assertEquals(ResponseKind.AMBIGUOUS, ServerResponse.EMPTY.kind());
    assertEquals(ResponseKind.BARE_ERROR, response("", 400, PlayerSnapshot.EMPTY).kind());
  }

  @Test
  void knownTypesMapToTheirKinds() {
    assertEquals(ResponseKind.REGISTERED,
        response(EventTypes.LEADERBOARD_ENTRY_START, 0, PlayerSnapshot.EMPTY).kind());
    assertEquals(ResponseKind.BET_TURN, response(EventTypes.PLAYER_BET, 0, PlayerSnapshot.EMPTY).kind());
    assertEquals(ResponseKind.TERMINAL, response(EventTypes.GAME_OVER, 0, PlayerSnapshot.EMPTY).kind());
    assertEquals(ResponseKind.TERMINAL,
        response(EventTypes.LEADERBOARD_ENTRY_END, 0, PlayerSnapshot.EMPTY).kind());
    assertEquals(ResponseKind.OTHER, response(EventTypes.POT_WON, 0, PlayerSnapshot.EMPTY).kind());
  }

  @Test
  void turnBelongsOnlyToTheNamedPlayer() {
    ServerResponse turn = response(EventTypes.PLAYER_BET, 0, new PlayerSnapshot("p7", 500));

    assertTrue(turn.isTurnFor("p7"));
    assertFalse(turn.isTurnFor("p8"));
    assertFalse(response(EventTypes.POT_WON, 0, new PlayerSnapshot("p7", 500)).isTurnFor("p7"));
  }

  @Test
  void nullFieldsBecomeZeroValues() {
    ServerResponse response = new ServerResponse(null, null, 0, null, null, null, null, 0L);

    assertEquals(ServerResponse.EMPTY, response);
  }

  private static ServerResponse response(String type, int code, PlayerSnapshot player) {
    return new ServerResponse(type, "", code, "", "", "", player, 0L);
  }
}
