/**
 * <strong>Purpose:</strong> Wire-level vocabulary of the poker server protocol.
 * <p>Requests are a sealed hierarchy ({@link ca.gc.cra.swarm.domain.protocol.Registration},
 * {@link ca.gc.cra.swarm.domain.protocol.Action}); responses decode into a single
 * {@link ca.gc.cra.swarm.domain.protocol.ServerResponse} record whose absent fields hold zero values.</p>
 * <p><strong>Concurrency:</strong> Immutable value types.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.domain.protocol;
