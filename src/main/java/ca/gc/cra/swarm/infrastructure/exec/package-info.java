/**
 * Executor factories for session and soak worker pools.
 * <p><strong>Concurrency:</strong> Returned executors are fixed-size; callers own shutdown.</p>
 * <p><strong>Security:</strong> Thread names carry only a prefix and an index, never player credentials.</p>
 */
package ca.gc.cra.swarm.infrastructure.exec;
