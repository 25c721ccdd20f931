package ca.gc.cra.swarm.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("short", Logs.truncate("short", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void truncateCutsAtByteLimitWithoutSplittingCharacters() {
    String truncated = Logs.truncate("ééééé", 5);

    assertTrue(truncated.startsWith("éé... (truncated, 5 of 10 bytes)"), truncated);
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void redactHidesSecrets() {
    assertEquals("[REDACTED]", Logs.redact("hunter2"));
  }

  @Test
  void rootLevelCanBeRaised() {
    Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    Level previous = root.getLevel();
    try {
      LoggingConfigurator.enableVerboseLogging();
      assertEquals(Level.DEBUG, root.getLevel());
    } finally {
      LoggingConfigurator.setRootLevel(previous);
    }
  }
}
