package ca.gc.cra.swarm.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesCommandOptionsAndFlags() {
    CliInput input = CliInput.parse(new String[] {"Play", "players=5", "-v", "--DRY-RUN", " ", null});

    assertEquals("play", input.command());
    assertArrayEquals(new String[] {"players=5"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--dry-run"));
    assertFalse(input.help());
  }

  @Test
  void subcommandArgsDropOnlyTheCommand() {
    CliInput input = CliInput.parse(new String[] {"soak", "extra", "gameId=g1", "-h"});

    assertEquals(List.of("extra", "gameId=g1", "--help"), List.of(input.subcommandArgs()));
    assertEquals("extra", CliInput.parse(input.subcommandArgs()).command());
  }

  @Test
  void emptyInputHasNoCommand() {
    CliInput input = CliInput.parse(null);

    assertEquals("", input.command());
    assertEquals(0, input.subcommandArgs().length);
  }
}
