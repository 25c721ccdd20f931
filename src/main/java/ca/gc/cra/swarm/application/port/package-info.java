/**
 * <strong>Purpose:</strong> Ports between the session/harness core and its adapters.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces for
 * sockets, JSON, HTTP, clocks, and metrics.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.application.port;
