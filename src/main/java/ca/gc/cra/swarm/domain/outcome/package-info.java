/**
 * Aggregate run outcomes: the fixed counter set and its immutable snapshot.
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.domain.outcome;
