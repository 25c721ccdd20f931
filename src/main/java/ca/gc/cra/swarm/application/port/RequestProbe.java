package ca.gc.cra.swarm.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Sends one stateless request to a fixed target.
 * <p><strong>Role:</strong> Port driven by the duration-bounded soak workers.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use by every worker.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RequestProbe {
  /**
   * Sends one request and waits for its response.
   *
   * @return {@code true} when the target answered successfully
   * @throws IOException when the request could not be completed
   * @throws InterruptedException when the calling worker is interrupted
   */
  boolean send() throws IOException, InterruptedException;
}
