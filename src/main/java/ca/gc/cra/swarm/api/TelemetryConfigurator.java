package ca.gc.cra.swarm.api;

import ca.gc.cra.swarm.validation.Net;
import ca.gc.cra.swarm.validation.Strings;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the metrics options out of a command's option map into the {@code otel.*} system properties read by
 * the metrics adapter.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Validates and applies {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes},
   * removing them from {@code args}. Blank values leave the corresponding property untouched.
   *
   * @param args mutable option map
   * @return the effective exporter name
   * @throws IllegalArgumentException when a value is invalid
   */
  static String configureMetrics(Map<String, String> args) {
    String exporter = blankToEmpty(args.remove("metricsExporter")).toLowerCase(Locale.ROOT);
    if (exporter.isEmpty()) {
      exporter = "none";
    }
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    System.setProperty("otel.metrics.exporter", exporter);

    String endpoint = blankToEmpty(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      Net.validateHttpUrl("otelEndpoint", endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String resourceAttributes = blankToEmpty(args.remove("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
    log.debug("Metrics exporter: {}", exporter);
    return exporter;
  }

  private static String blankToEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
