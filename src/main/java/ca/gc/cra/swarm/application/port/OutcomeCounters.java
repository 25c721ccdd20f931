package ca.gc.cra.swarm.application.port;

import ca.gc.cra.swarm.domain.outcome.Counter;
import ca.gc.cra.swarm.domain.outcome.CounterSnapshot;

/**
 * <strong>What:</strong> Aggregator of run outcomes injected into every session and worker.
 * <p><strong>Role:</strong> Port; the production adapter is {@code AtomicOutcomeCounters}, tests substitute a
 * recording double to assert exact increments per scenario.</p>
 * <p><strong>Thread-safety:</strong> {@link #increment(Counter)} must be an atomic fetch-add safe for
 * concurrent callers. Counters never decrease.</p>
 *
 * @since 0.1.0
 */
public interface OutcomeCounters {
  /**
   * Atomically adds one to {@code counter}.
   *
   * @param counter counter to increment; must not be {@code null}
   */
  void increment(Counter counter);

  /**
   * Reads the current value of {@code counter}.
   *
   * @param counter counter to read
   * @return current value
   */
  long get(Counter counter);

  /**
   * Copies every counter value. Intended to be called once after all sessions have joined.
   *
   * @return immutable snapshot
   */
  CounterSnapshot snapshot();
}
