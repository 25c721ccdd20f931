package ca.gc.cra.swarm.application.session;

/**
 * Creates the session for a sequential player id.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SessionFactory {
  /**
   * Creates a fresh, not yet started session.
   *
   * @param id sequential player id
   * @return new session owned by the caller
   */
  PlayerSession create(long id);
}
