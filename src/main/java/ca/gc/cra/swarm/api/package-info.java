/**
 * <strong>Purpose:</strong> Command-line surface of SWARM: argument parsing, configuration loading, dry-run plans,
 * run summaries and exit codes.
 * <p><strong>Output:</strong> Operator results go through {@link ca.gc.cra.swarm.api.CliPrinter}; diagnostics go
 * through SLF4J.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.api;
