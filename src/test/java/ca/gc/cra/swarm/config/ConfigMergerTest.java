package ca.gc.cra.swarm.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("play");
    Map<String, String> yaml = Map.of("server", "yaml-host:1", "players", "20");
    Map<String, String> cli = Map.of("players", "30");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "play", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("yaml-host:1", merged.get("server"));
    assertEquals("30", merged.get("players"));
    assertEquals("100", merged.get("concurrency"));
    assertEquals(List.of("CLI overrides YAML for key: players"), warnings);
  }

  @Test
  void unknownKeysAreRejected() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("register");

    IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("register", Optional.empty(), Map.of("player", "5"), defaults,
            msg -> {}));
    assertTrue(error.getMessage().contains("player"));
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("register", Optional.of(Map.of("workers", "5")), Map.of(),
            defaults, msg -> {}));
  }

  @Test
  void cliSoakTargetReplacesYamlTarget() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("soak");
    Map<String, String> yaml = Map.of("targetPlayer", "bot-1", "workers", "8");

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "soak", Optional.of(yaml), Map.of("gameId", "g7"), defaults, msg -> {});

    assertEquals("g7", merged.get("gameId"));
    assertEquals("", merged.get("targetPlayer"));
    assertEquals("8", merged.get("workers"));
  }

  @Test
  void yamlSoakTargetSurvivesWithoutCliTarget() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("soak");

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "soak", Optional.of(Map.of("targetPlayer", "bot-1")), Map.of("workers", "3"), defaults, msg -> {});

    assertEquals("bot-1", merged.get("targetPlayer"));
  }
}
