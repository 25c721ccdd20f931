package ca.gc.cra.swarm.infrastructure.net;

import java.io.IOException;
import java.util.Objects;

/**
 * I/O failure of a session connection, tagged with what went wrong so diagnostics can tell an EOF or a
 * timeout apart from a broken socket.
 *
 * @since 0.1.0
 */
public final class TransportException extends IOException {
  private static final long serialVersionUID = 1L;

  /** Failure category. */
  public enum Kind {
    /** The connection could not be established. */
    CONNECT,
    /** A connect, read or write deadline elapsed. */
    TIMEOUT,
    /** The peer closed the stream. */
    EOF,
    /** Writing to the socket failed. */
    WRITE,
    /** Reading from the socket failed. */
    READ,
    /** An inbound line exceeded the configured byte limit. */
    OVERSIZED
  }

  private final Kind kind;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param kind failure category
   * @param message human-readable error
   */
  public TransportException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param kind failure category
   * @param message human-readable error
   * @param cause socket-level failure
   */
  public TransportException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure category.
   *
   * @return kind
   */
  public Kind kind() {
    return kind;
  }
}
