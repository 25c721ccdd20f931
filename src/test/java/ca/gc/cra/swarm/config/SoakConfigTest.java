package ca.gc.cra.swarm.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SoakConfigTest {

  @Test
  void targetUrlWinsOverGameId() {
    SoakConfig config = SoakConfig.fromMap(Map.of(
        "targetUrl", "http://game:8082/games/abc",
        "gameId", "other",
        "workers", "7",
        "durationSeconds", "5"));

    assertEquals(Optional.of(URI.create("http://game:8082/games/abc")), config.fixedTarget());
    assertEquals(7, config.workers());
    assertEquals(Duration.ofSeconds(5), config.duration());
  }

  @Test
  void gameIdTargetsTheGamePage() {
    SoakConfig config = SoakConfig.fromMap(Map.of("baseUrl", "http://api:8082/", "gameId", "g-42"));

    assertEquals(Optional.of(URI.create("http://api:8082/games/g-42")), config.fixedTarget());
  }

  @Test
  void targetPlayerNeedsALookup() {
    SoakConfig config = SoakConfig.fromMap(Map.of("targetPlayer", "bot-1", "locateAttempts", "3"));

    assertTrue(config.fixedTarget().isEmpty());
    assertEquals(Optional.of("bot-1"), config.targetPlayer());
    assertEquals(3, config.locateAttempts());
    assertEquals(Duration.ofMillis(50), config.failureBackoff());
    assertEquals(URI.create("http://localhost:8082/games/g1"), config.gameUrl("g1"));
  }

  @Test
  void missingTargetIsRejected() {
    IllegalArgumentException error =
        assertThrows(IllegalArgumentException.class, () -> SoakConfig.fromMap(Map.of("workers", "3")));
    assertTrue(error.getMessage().contains("targetPlayer"));
  }

  @Test
  void malformedValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> SoakConfig.fromMap(Map.of("targetUrl", "ftp://x/y")));
    assertThrows(IllegalArgumentException.class, () -> SoakConfig.fromMap(Map.of("gameId", "../admin")));
    assertThrows(IllegalArgumentException.class,
        () -> SoakConfig.fromMap(Map.of("gameId", "g1", "workers", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> SoakConfig.fromMap(Map.of("gameId", "g1", "durationSeconds", "0")));
  }
}
