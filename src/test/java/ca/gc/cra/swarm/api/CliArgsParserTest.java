package ca.gc.cra.swarm.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"server=host:1", "players=10", "passwordPrefix="});

    assertEquals(List.of("server", "players", "passwordPrefix"), List.copyOf(map.keySet()));
    assertEquals("host:1", map.get("server"));
    assertEquals("", map.get("passwordPrefix"));
  }

  @Test
  void valuesMayContainEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=env=perf,team=games"});

    assertEquals("env=perf,team=games", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedAndRepeatedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"players=1", "players=2"}));
  }
}
