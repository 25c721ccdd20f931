/**
 * Start-up support for the soak mode: locating the game that the soak workers will target.
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.application.soak;
