/**
 * <strong>Purpose:</strong> Wire codec for the line-delimited JSON game protocol.
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.infrastructure.protocol;
