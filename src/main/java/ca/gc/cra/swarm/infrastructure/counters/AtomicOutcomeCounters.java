package ca.gc.cra.swarm.infrastructure.counters;

import ca.gc.cra.swarm.application.port.MetricsPort;
import ca.gc.cra.swarm.application.port.OutcomeCounters;
import ca.gc.cra.swarm.domain.outcome.Counter;
import ca.gc.cra.swarm.domain.outcome.CounterSnapshot;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Lock-free {@link OutcomeCounters} backed by one {@link AtomicLong} per counter.
 * <p><strong>Observability:</strong> Every increment is mirrored to the {@link MetricsPort} under the counter's
 * dotted key.</p>
 * <p><strong>Thread-safety:</strong> The counter map is fully built in the constructor and never mutated;
 * increments are atomic fetch-adds.</p>
 *
 * @since 0.1.0
 */
public final class AtomicOutcomeCounters implements OutcomeCounters {
  private final Map<Counter, AtomicLong> values = new EnumMap<>(Counter.class);
  private final MetricsPort metrics;

  /** Creates counters that are not mirrored anywhere. */
  public AtomicOutcomeCounters() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates counters mirrored to {@code metrics}.
   *
   * @param metrics metrics sink; {@code null} disables mirroring
   */
  public AtomicOutcomeCounters(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    for (Counter counter : Counter.values()) {
      values.put(counter, new AtomicLong());
    }
  }

  @Override
  public void increment(Counter counter) {
    Objects.requireNonNull(counter, "counter");
    values.get(counter).incrementAndGet();
    metrics.increment(counter.metricKey());
  }

  @Override
  public long get(Counter counter) {
    return values.get(Objects.requireNonNull(counter, "counter")).get();
  }

  @Override
  public CounterSnapshot snapshot() {
    Map<Counter, Long> copy = new EnumMap<>(Counter.class);
    values.forEach((counter, value) -> copy.put(counter, value.get()));
    return new CounterSnapshot(copy);
  }
}
