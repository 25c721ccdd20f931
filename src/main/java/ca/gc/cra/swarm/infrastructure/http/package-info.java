/**
 * <strong>Purpose:</strong> {@link java.net.http.HttpClient} adapters for the soak mode: the request probe
 * hammering one URL and the game locator reading the games listing.
 *
 * @since 0.1.0
 */
package ca.gc.cra.swarm.infrastructure.http;
