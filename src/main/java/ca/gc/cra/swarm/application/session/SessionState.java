package ca.gc.cra.swarm.application.session;

/**
 * States of a player session, in their only legal order. {@link #TERMINATED} is absorbing.
 *
 * @since 0.1.0
 */
public enum SessionState {
  CONNECTING,
  REGISTERING,
  JOINING,
  INTERACTING,
  TERMINATED;

  /**
   * Indicates whether a session in this state may move to {@code next}.
   *
   * @param next candidate state
   * @return {@code true} when {@code next} lies strictly after this state
   */
  public boolean canAdvanceTo(SessionState next) {
    return next != null && next.ordinal() > ordinal();
  }
}
