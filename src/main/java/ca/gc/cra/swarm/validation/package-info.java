/**
 * <strong>Purpose:</strong> Input validation for configuration values: numeric ranges, printable strings and
 * network endpoints. Every helper throws {@link java.lang.IllegalArgumentException} naming the offending key.
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.validation;
