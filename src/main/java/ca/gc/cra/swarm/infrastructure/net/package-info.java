/**
 * <strong>Purpose:</strong> Blocking TCP transport for player sessions: connect with a deadline, send and receive
 * newline-delimited lines with per-operation deadlines, and release the socket exactly once.
 * <p><strong>Errors:</strong> Every failure surfaces as {@link ca.gc.cra.swarm.infrastructure.net.TransportException}
 * carrying its {@link ca.gc.cra.swarm.infrastructure.net.TransportException.Kind}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.infrastructure.net;
