package ca.gc.cra.swarm.domain.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class CredentialsTest {

  @Test
  void deriveAppendsTheSessionId() {
    Credentials credentials = Credentials.derive("bot-", "secret", 42);

    assertEquals("bot-42", credentials.username());
    assertEquals("secret42", credentials.password());
  }

  @Test
  void passwordNeverAppearsInToString() {
    Credentials credentials = Credentials.derive("bot-", "secret", 42);

    assertFalse(credentials.toString().contains("secret"));
    assertFalse(Registration.of(credentials).toString().contains("secret"));
  }

  @Test
  void negativeIdIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Credentials.derive("bot-", "secret", -1));
  }

  @Test
  void betRejectsNegativeAmounts() {
    assertThrows(IllegalArgumentException.class, () -> Action.bet(-5));
    assertEquals(Action.FOLD_AMOUNT, Action.fold().wireAmount().getAsLong());
  }
}
