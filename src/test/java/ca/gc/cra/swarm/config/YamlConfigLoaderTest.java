package ca.gc.cra.swarm.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommonSection() throws IOException {
    Path yaml = tempDir.resolve("swarm.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          server: game:9000
        play:
          server: table:8083
          players: 500
        soak:
          workers: 10
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "play");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("table:8083", map.get("server"));
    assertEquals("500", map.get("players"));
    assertFalse(map.containsKey("workers"));
  }

  @Test
  void emptyValuesAreUnsetAndCommandNamesIgnoreCase() throws IOException {
    Path yaml = tempDir.resolve("soak.yaml");
    Files.writeString(yaml, """
        Common:
          otelEndpoint: http://collector:4317
        soak:
          targetPlayer:
          workers: 8
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "SOAK").orElseThrow();

    assertEquals(Map.of("otelEndpoint", "http://collector:4317", "targetPlayer", "", "workers", "8"), map);
  }

  @Test
  void onlySwarmSectionsAreAccepted() throws IOException {
    Path yaml = tempDir.resolve("typo.yaml");
    Files.writeString(yaml, """
        plya:
          players: 10
        """);

    IllegalArgumentException error =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "play"));
    assertTrue(error.getMessage().contains("plya"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "common"));
  }

  @Test
  void otherCommandSectionsAreStillChecked() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        play:
          players: 10
        soak:
          otel:
            endpoint: http://collector:4317
        """);

    IllegalArgumentException error =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "play"));
    assertTrue(error.getMessage().contains("soak.otel"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "play").isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "register").orElseThrow());
  }

  @Test
  void invalidStructuresAreRejected() throws IOException {
    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, """
        - play:
            players: 1
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "play"));

    Path array = tempDir.resolve("array.yaml");
    Files.writeString(array, """
        play:
          players: [1, 2]
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(array, "play"));

    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "play: [unclosed");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "play"));
  }

  @Test
  void arbitraryTypeTagsAreNotInstantiated() throws IOException {
    Path yaml = tempDir.resolve("tagged.yaml");
    Files.writeString(yaml, """
        play:
          players: !!java.io.File [/tmp]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "play"));
  }
}
