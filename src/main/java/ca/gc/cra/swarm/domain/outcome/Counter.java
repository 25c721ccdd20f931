package ca.gc.cra.swarm.domain.outcome;

/**
 * Aggregate outcome counters shared by every session or worker of a run.
 *
 * <p>Each constant carries the dotted metric key mirrored to the metrics port and the label
 * printed in the run summary.</p>
 *
 * @since 0.1.0
 */
public enum Counter {
  REGISTRATION_OK("session.registration.ok", "Successful registrations"),
  REGISTRATION_FAILED("session.registration.failed", "Failed registrations"),
  GAME_JOINED("session.game.joined", "Games joined"),
  ALL_IN("session.bet.allin", "All-in bets made"),
  FOLD("session.bet.fold", "Folds made"),
  SESSION_CRASHED("session.crashed", "Sessions crashed"),
  REQUEST_SENT("soak.request.sent", "Requests sent"),
  REQUEST_OK("soak.request.ok", "Successful requests"),
  REQUEST_FAILED("soak.request.failed", "Failed requests");

  private final String metricKey;
  private final String label;

  Counter(String metricKey, String label) {
    this.metricKey = metricKey;
    this.label = label;
  }

  /**
   * Returns the dotted metric key.
   *
   * @return metric key such as {@code session.registration.ok}
   */
  public String metricKey() {
    return metricKey;
  }

  /**
   * Returns the human readable summary label.
   *
   * @return summary label
   */
  public String label() {
    return label;
  }
}
