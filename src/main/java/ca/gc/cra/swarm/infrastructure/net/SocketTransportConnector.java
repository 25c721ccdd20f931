package ca.gc.cra.swarm.infrastructure.net;

import ca.gc.cra.swarm.application.port.SessionTransport;
import ca.gc.cra.swarm.application.port.TransportConnector;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * <strong>What:</strong> Opens blocking TCP connections to the game server.
 * <p><strong>Resources:</strong> Owns the shared write-deadline watchdog thread used by every connection it
 * opens; {@link #close()} stops it once the run has joined.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent {@link #open(InetSocketAddress, Duration)} calls.</p>
 *
 * @since 0.1.0
 */
public final class SocketTransportConnector implements TransportConnector, AutoCloseable {
  private final int maxLineBytes;
  private final ScheduledExecutorService watchdog;

  /**
   * Creates a connector.
   *
   * @param maxLineBytes upper bound on inbound line length; must be positive
   */
  public SocketTransportConnector(int maxLineBytes) {
    if (maxLineBytes <= 0) {
      throw new IllegalArgumentException("maxLineBytes must be positive");
    }
    this.maxLineBytes = maxLineBytes;
    ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
      Thread thread = Executors.defaultThreadFactory().newThread(runnable);
      thread.setName("swarm-write-watchdog");
      thread.setDaemon(true);
      return thread;
    });
    scheduler.setRemoveOnCancelPolicy(true);
    this.watchdog = scheduler;
  }

  @Override
  public SessionTransport open(InetSocketAddress address, Duration connectTimeout) throws IOException {
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    if (address.isUnresolved()) {
      throw new TransportException(TransportException.Kind.CONNECT, "unresolved address " + address);
    }
    Socket socket = new Socket();
    try {
      socket.setTcpNoDelay(true);
      socket.connect(address, Timeouts.toMillis(connectTimeout));
      return new SocketSessionTransport(socket, maxLineBytes, watchdog);
    } catch (SocketTimeoutException ex) {
      closeQuietly(socket, ex);
      throw new TransportException(
          TransportException.Kind.TIMEOUT,
          "connect to " + address + " timed out after " + connectTimeout.toMillis() + " ms",
          ex);
    } catch (IOException ex) {
      closeQuietly(socket, ex);
      throw new TransportException(
          TransportException.Kind.CONNECT, "connect to " + address + " failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() {
    watchdog.shutdownNow();
  }

  private static void closeQuietly(Socket socket, IOException primary) {
    try {
      socket.close();
    } catch (IOException closeFailure) {
      primary.addSuppressed(closeFailure);
    }
  }
}
