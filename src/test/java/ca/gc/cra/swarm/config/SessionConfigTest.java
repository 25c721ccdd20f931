package ca.gc.cra.swarm.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SessionConfigTest {

  @Test
  void fromMapParsesEveryKey() {
    SessionConfig config = SessionConfig.fromMap(Map.ofEntries(
        Map.entry("server", "[::1]:9000"),
        Map.entry("players", "2500"),
        Map.entry("concurrency", "250"),
        Map.entry("usernamePrefix", "load-"),
        Map.entry("passwordPrefix", ""),
        Map.entry("firstId", "1000"),
        Map.entry("connectTimeoutMs", "1500"),
        Map.entry("ioTimeoutMs", "2500"),
        Map.entry("activityTimeoutMs", "90000"),
        Map.entry("maxLineBytes", "65536"),
        Map.entry("progressEvery", "0"),
        Map.entry("startDelayMs", "200")));

    assertEquals("[::1]:9000", config.serverLabel());
    assertTrue(config.server().isUnresolved());
    assertEquals(2500, config.players());
    assertEquals(250, config.concurrency());
    assertEquals("load-", config.usernamePrefix());
    assertEquals("", config.passwordPrefix());
    assertEquals(1000, config.firstId());
    assertEquals(Duration.ofMillis(1500), config.connectTimeout());
    assertEquals(Duration.ofMillis(2500), config.ioTimeout());
    assertEquals(Duration.ofSeconds(90), config.activityTimeout());
    assertEquals(65536, config.maxLineBytes());
    assertEquals(0, config.progressEvery());
    assertEquals(Duration.ofMillis(200), config.startDelay());
  }

  @Test
  void blankValuesFallBackToDefaults() {
    SessionConfig config = SessionConfig.fromMap(Map.of("server", "", "players", " "));

    assertEquals(SessionConfig.defaults(), config);
  }

  @Test
  void outOfRangeValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> SessionConfig.fromMap(Map.of("players", "0")));
    assertThrows(IllegalArgumentException.class, () -> SessionConfig.fromMap(Map.of("concurrency", "10001")));
    assertThrows(IllegalArgumentException.class, () -> SessionConfig.fromMap(Map.of("ioTimeoutMs", "0")));
    assertThrows(IllegalArgumentException.class, () -> SessionConfig.fromMap(Map.of("maxLineBytes", "10")));
    assertThrows(IllegalArgumentException.class, () -> SessionConfig.fromMap(Map.of("players", "many")));
    assertThrows(IllegalArgumentException.class, () -> SessionConfig.fromMap(Map.of("server", "localhost")));
    assertThrows(IllegalArgumentException.class,
        () -> SessionConfig.fromMap(Map.of("usernamePrefix", "café-")));
  }

  @Test
  void idsMustNotOverflow() {
    assertThrows(IllegalArgumentException.class, () -> SessionConfig.fromMap(Map.of(
        "firstId", Long.toString(Long.MAX_VALUE - 5), "players", "10")));
  }
}
