package ca.gc.cra.swarm.application.session;

/**
 * Why a session reached {@link SessionState#TERMINATED}.
 *
 * @since 0.1.0
 */
public enum TerminationReason {
  /** The connection could not be established. */
  CONNECT_FAILED,
  /** The server answered the registration with a non-zero code. */
  REGISTRATION_REJECTED,
  /** The server answered the registration with an unexpected message. */
  REGISTRATION_UNEXPECTED,
  /** Sending the registration or reading its answer failed. */
  REGISTRATION_INCOMPLETE,
  /** Registration succeeded and the plan stops there. */
  REGISTERED,
  /** The join action could not be sent. */
  JOIN_FAILED,
  /** The game ended or the player left the leaderboard. */
  GAME_ENDED,
  /** The session stayed in the game longer than the activity timeout. */
  ACTIVITY_TIMEOUT,
  /** A read failed, hit end of stream, or returned an undecodable line. */
  CONNECTION_LOST,
  /** A bet or fold could not be sent. */
  SEND_FAILED
}
