package ca.gc.cra.swarm.application.session;

/**
 * How far a session drives the protocol.
 *
 * @since 0.1.0
 */
public enum SessionPlan {
  /** Register, join a table, then bet all-in once and fold every later turn. */
  PLAY,
  /** Register and disconnect. */
  REGISTER_ONLY
}
