/**
 * <strong>Purpose:</strong> Domain model for SWARM runs.
 * <p><strong>Pipeline role:</strong> Value types shared by the session state machine, the harnesses, and the
 * adapters; no I/O happens here.</p>
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.domain;
