package ca.gc.cra.swarm.application.harness;

import ca.gc.cra.swarm.application.session.TerminationReason;
import ca.gc.cra.swarm.domain.outcome.CounterSnapshot;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Final report of a harness run, produced once after every session or worker has joined.
 *
 * @param counters aggregate counters read after the join
 * @param terminations session count per termination reason; empty for soak runs
 * @param launched sessions (or workers) started
 * @param completed sessions (or workers) that finished
 * @param peakActive highest number of sessions (or workers) running at the same time
 * @param elapsed wall-clock duration of the run
 * @param interrupted whether the run was cut short by an interrupt
 * @since 0.1.0
 */
public record RunSummary(
    CounterSnapshot counters,
    Map<TerminationReason, Long> terminations,
    long launched,
    long completed,
    int peakActive,
    Duration elapsed,
    boolean interrupted) {

  public RunSummary {
    Objects.requireNonNull(counters, "counters");
    Objects.requireNonNull(elapsed, "elapsed");
    EnumMap<TerminationReason, Long> copy = new EnumMap<>(TerminationReason.class);
    copy.putAll(Objects.requireNonNull(terminations, "terminations"));
    terminations = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns how many sessions ended for {@code reason}.
   *
   * @param reason termination reason
   * @return session count; zero when none
   */
  public long terminations(TerminationReason reason) {
    return terminations.getOrDefault(reason, 0L);
  }
}
