package ca.gc.cra.swarm.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = OpenTelemetryMetricsAdapter.withReader(reader);
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsMonotonicCounter() {
    adapter.increment("session.bet.fold");
    adapter.increment("session.bet.fold");
    adapter.increment("session.bet.fold");

    MetricData counter = find(reader.collectAllMetrics(), "session.bet.fold");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    assertTrue(counter.getLongSumData().isMonotonic());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());

    assertEquals("swarm", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeRecordsHistogramInMilliseconds() {
    adapter.observe("session.duration.millis", 40);
    adapter.observe("session.duration.millis", 60);

    MetricData histogram = find(reader.collectAllMetrics(), "session.duration.millis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(100.0, point.getSum(), 0.0001);
  }

  @Test
  void noopMetersDiscardUpdates() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Meters.noop());

    noop.increment("session.bet.fold");
    noop.observe("session.duration.millis", 10);
    noop.close();

    assertTrue(noop.isNoop());
  }

  @Test
  void parsesResourceAttributesAndSkipsMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=perf, team = games ,broken,=x");

    assertEquals(2, attributes.size());
    assertEquals("perf", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("games", attributes.get(AttributeKey.stringKey("team")));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported"));
  }
}
