/**
 * Jackson streaming helpers for the HTTP side of SWARM.
 */
package ca.gc.cra.swarm.infrastructure.json;
