package ca.gc.cra.swarm.domain.outcome;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time copy of every aggregate counter.
 *
 * @param values counter values; counters missing from the map read as zero
 * @since 0.1.0
 */
public record CounterSnapshot(Map<Counter, Long> values) {
  public CounterSnapshot {
    Objects.requireNonNull(values, "values");
    EnumMap<Counter, Long> copy = new EnumMap<>(Counter.class);
    copy.putAll(values);
    values = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the value of {@code counter}.
   *
   * @param counter counter to read
   * @return counter value; zero when never incremented
   */
  public long get(Counter counter) {
    return values.getOrDefault(counter, 0L);
  }
}
