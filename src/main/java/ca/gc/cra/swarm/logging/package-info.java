/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize protocol payloads before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; safe from every session thread.</p>
 * <p><strong>Security:</strong> Provides redaction so passwords never reach the logs.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.logging;
