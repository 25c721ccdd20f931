package ca.gc.cra.swarm.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parseInRangeTrimsAndChecksBounds() {
    assertEquals(42L, Numbers.parseInRange("players", " 42 ", 1, 100));
    IllegalArgumentException error =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("players", "101", 1, 100));
    assertTrue(error.getMessage().startsWith("players must be between 1 and 100"));
  }

  @Test
  void nonNumericInputIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("players", "1e3", 1, 10_000));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("players", " ", 1, 10));
  }
}
