package ca.gc.cra.swarm.application.port;

/**
 * <strong>What:</strong> Port abstracting SWARM metrics emission.
 * <p><strong>Why:</strong> Lets the harness mirror outcome counters and session timings to an external backend
 * without binding sessions to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every session thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code session.duration.millis}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code session.bet.fold}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value in the units named by the key
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
