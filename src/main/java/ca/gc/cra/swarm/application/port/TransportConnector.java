package ca.gc.cra.swarm.application.port;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * <strong>What:</strong> Factory opening {@link SessionTransport} connections to the game server.
 * <p><strong>Thread-safety:</strong> Must be safe for concurrent use by every session thread.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TransportConnector {
  /**
   * Opens a connection to {@code address}.
   *
   * @param address game server address
   * @param connectTimeout maximum time to establish the connection
   * @return open transport owned by the caller
   * @throws IOException when the connection cannot be established in time
   */
  SessionTransport open(InetSocketAddress address, Duration connectTimeout) throws IOException;
}
