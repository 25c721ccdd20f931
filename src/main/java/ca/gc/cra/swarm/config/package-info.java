/**
 * <strong>Purpose:</strong> Configuration layering (embedded defaults, YAML, CLI) and the composition root that
 * wires ports to adapters.
 * <p><strong>Validation:</strong> Records such as {@link ca.gc.cra.swarm.config.SessionConfig} validate in their
 * canonical constructors; {@code fromMap} factories reject malformed values with
 * {@link java.lang.IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.config;
