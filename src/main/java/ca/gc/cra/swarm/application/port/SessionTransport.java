package ca.gc.cra.swarm.application.port;

import java.io.IOException;
import java.time.Duration;

/**
 * <strong>What:</strong> One open, line-delimited byte-stream connection owned by a single session.
 * <p><strong>Deadlines:</strong> every read and write arms its own deadline relative to the moment it is
 * invoked, so a slow but live peer only trips when a single operation stalls.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; a session drives its transport sequentially. Only
 * {@link #close()} may be called from another thread.</p>
 *
 * @since 0.1.0
 */
public interface SessionTransport extends AutoCloseable {
  /**
   * Writes {@code line} followed by the {@code '\n'} terminator.
   *
   * @param line payload without terminator
   * @param timeout maximum time the write may block
   * @throws IOException when the write fails or exceeds {@code timeout}
   */
  void sendLine(String line, Duration timeout) throws IOException;

  /**
   * Reads the next line, without its terminator.
   *
   * @param timeout maximum time to wait for a complete line
   * @return line text
   * @throws IOException on timeout, end of stream, or socket failure
   */
  String readLine(Duration timeout) throws IOException;

  /** Releases the underlying connection. Idempotent; never throws. */
  @Override
  void close();
}
