/**
 * Metrics adapter that bridges the SWARM metrics port to OpenTelemetry.
 * <p><strong>Metrics:</strong> Publishes under the {@code session.*} and {@code soak.*} namespaces.</p>
 */
package ca.gc.cra.swarm.infrastructure.metrics;
