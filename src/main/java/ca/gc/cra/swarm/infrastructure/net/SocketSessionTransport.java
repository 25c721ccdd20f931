package ca.gc.cra.swarm.infrastructure.net;

import ca.gc.cra.swarm.application.port.SessionTransport;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SessionTransport} over one blocking TCP socket.
 * <p><strong>Deadlines:</strong> reads use the socket timeout, re-armed on every call. Blocking writes have no
 * socket-level timeout, so each write schedules a watchdog that closes the socket when the deadline passes;
 * the interrupted write then fails as {@link TransportException.Kind#TIMEOUT}.</p>
 * <p><strong>Thread-safety:</strong> One session thread sends and receives. {@link #close()} is idempotent
 * and may race with the write watchdog.</p>
 *
 * @since 0.1.0
 */
final class SocketSessionTransport implements SessionTransport {
  private static final Logger log = LoggerFactory.getLogger(SocketSessionTransport.class);

  private final Socket socket;
  private final LineReader reader;
  private final OutputStream out;
  private final ScheduledExecutorService watchdog;
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicBoolean writeTimedOut = new AtomicBoolean();

  SocketSessionTransport(Socket socket, int maxLineBytes, ScheduledExecutorService watchdog) throws IOException {
    this.socket = Objects.requireNonNull(socket, "socket");
    this.watchdog = Objects.requireNonNull(watchdog, "watchdog");
    this.reader = new LineReader(socket.getInputStream(), maxLineBytes);
    this.out = new BufferedOutputStream(socket.getOutputStream());
  }

  @Override
  public void sendLine(String line, Duration timeout) throws IOException {
    Objects.requireNonNull(line, "line");
    ensureOpen();
    byte[] payload = (line + "\n").getBytes(StandardCharsets.UTF_8);
    ScheduledFuture<?> guard = scheduleWriteGuard(timeout);
    try {
      out.write(payload);
      out.flush();
    } catch (IOException ex) {
      if (writeTimedOut.get()) {
        throw new TransportException(
            TransportException.Kind.TIMEOUT, "write timed out after " + timeout.toMillis() + " ms", ex);
      }
      throw new TransportException(TransportException.Kind.WRITE, "write failed: " + ex.getMessage(), ex);
    } finally {
      if (guard != null) {
        guard.cancel(false);
      }
    }
  }

  @Override
  public String readLine(Duration timeout) throws IOException {
    ensureOpen();
    try {
      socket.setSoTimeout(Timeouts.toMillis(timeout));
      return reader.readLine();
    } catch (SocketTimeoutException ex) {
      throw new TransportException(
          TransportException.Kind.TIMEOUT, "read timed out after " + timeout.toMillis() + " ms", ex);
    } catch (TransportException ex) {
      throw ex;
    } catch (IOException ex) {
      throw new TransportException(TransportException.Kind.READ, "read failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Failed to close connection to {}: {}", socket.getRemoteSocketAddress(), ex.getMessage());
    }
  }

  boolean isClosed() {
    return closed.get();
  }

  private ScheduledFuture<?> scheduleWriteGuard(Duration timeout) {
    try {
      return watchdog.schedule(() -> {
        writeTimedOut.set(true);
        close();
      }, Timeouts.toMillis(timeout), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      log.debug("Write watchdog unavailable; sending without a write deadline");
      return null;
    }
  }

  private void ensureOpen() throws TransportException {
    if (closed.get()) {
      TransportException.Kind kind =
          writeTimedOut.get() ? TransportException.Kind.TIMEOUT : TransportException.Kind.EOF;
      throw new TransportException(kind, "connection already closed");
    }
  }
}
