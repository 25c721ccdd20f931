package ca.gc.cra.swarm.infrastructure.net;

import java.time.Duration;

/** Converts deadlines into the positive {@code int} millisecond values socket APIs accept. */
final class Timeouts {
  private Timeouts() {}

  /**
   * Clamps {@code timeout} to {@code [1, Integer.MAX_VALUE]} milliseconds; zero would mean "wait forever".
   *
   * @param timeout deadline relative to now
   * @return socket timeout in milliseconds
   */
  static int toMillis(Duration timeout) {
    long millis = timeout.toMillis();
    if (millis < 1L) {
      return 1;
    }
    return (int) Math.min(millis, Integer.MAX_VALUE);
  }
}
