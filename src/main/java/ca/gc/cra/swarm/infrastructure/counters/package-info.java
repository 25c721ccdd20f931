/**
 * <strong>Purpose:</strong> Production adapter for the run-wide outcome counters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.infrastructure.counters;
