package ca.gc.cra.swarm.application.session;

import java.util.Objects;

/**
 * Terminal outcome of one player session.
 *
 * @param username session username
 * @param reason why the session terminated
 * @param allInCommitted whether the session placed its one all-in bet
 * @since 0.1.0
 */
public record SessionResult(String username, TerminationReason reason, boolean allInCommitted) {
  public SessionResult {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(reason, "reason");
  }
}
