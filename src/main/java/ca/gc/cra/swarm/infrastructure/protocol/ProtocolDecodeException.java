package ca.gc.cra.swarm.infrastructure.protocol;

import java.io.IOException;

/**
 * Thrown when an inbound line is not a well-formed server message.
 *
 * @since 0.1.0
 */
public final class ProtocolDecodeException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public ProtocolDecodeException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying parser failure.
   *
   * @param message human-readable error
   * @param cause parser failure
   */
  public ProtocolDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
