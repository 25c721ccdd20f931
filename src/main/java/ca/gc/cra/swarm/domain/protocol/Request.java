package ca.gc.cra.swarm.domain.protocol;

/**
 * Outbound message written by a player session, one per wire line.
 *
 * @since 0.1.0
 */
public sealed interface Request permits Registration, Action {}
