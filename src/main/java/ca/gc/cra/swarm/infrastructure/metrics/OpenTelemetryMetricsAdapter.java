package ca.gc.cra.swarm.infrastructure.metrics;

import ca.gc.cra.swarm.application.port.MetricsPort;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> {@link MetricsPort} that records SWARM counters and session timings through
 * OpenTelemetry.
 * <p>Counter keys become monotonic {@link LongCounter}s and observations become {@link LongHistogram}s, one
 * instrument per key, created on first use. With the {@code none} exporter every update goes to the noop meter.</p>
 * <p><strong>Thread-safety:</strong> Instrument caches are concurrent maps; safe from every session thread.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private final OpenTelemetryBootstrap.Meters meters;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from the {@code otel.*} system properties or environment. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Meters meters) {
    this.meters = Objects.requireNonNull(meters, "meters");
  }

  /**
   * Creates an adapter that reports to {@code reader}; used to inspect metrics in-process.
   *
   * @param reader metric reader registered on a fresh meter provider
   * @return adapter backed by an active SDK provider
   */
  static OpenTelemetryMetricsAdapter withReader(MetricReader reader) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.withReader(reader, Attributes.empty()));
  }

  /**
   * Indicates whether updates are discarded.
   *
   * @return {@code true} when no exporter is configured
   */
  public boolean isNoop() {
    return meters.isNoop();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::createCounter).add(1);
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::createHistogram).record(value);
  }

  /** Flushes pending exports and shuts the meter provider down. */
  @Override
  public void close() {
    meters.close();
  }

  private LongCounter createCounter(String key) {
    Meter meter = meters.meter();
    return meter.counterBuilder(key)
        .setUnit("1")
        .setDescription("SWARM counter " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    Meter meter = meters.meter();
    return meter.histogramBuilder(key)
        .ofLongs()
        .setUnit(key.endsWith(".millis") ? "ms" : "1")
        .setDescription("SWARM observation " + key)
        .build();
  }
}
