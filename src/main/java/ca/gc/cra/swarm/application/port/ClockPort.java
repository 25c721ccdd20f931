package ca.gc.cra.swarm.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to sessions and harnesses.
 * <p><strong>Why:</strong> Activity deadlines and run durations are measured against this clock so tests can
 * drive them deterministically.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.swarm.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();
}
