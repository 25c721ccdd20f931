package ca.gc.cra.swarm.application.session;

import ca.gc.cra.swarm.application.port.SessionTransport;
import java.io.EOFException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Test double replaying scripted server lines and recording every line the session sends.
 */
final class ScriptedTransport implements SessionTransport {
  private final Deque<Object> inbound = new ArrayDeque<>();
  private final List<String> sent = new ArrayList<>();
  private final FakeClock clock;
  private long millisPerRead;
  private int failSendAt = -1;
  private int closeCount;

  ScriptedTransport(FakeClock clock) {
    this.clock = clock;
  }

  ScriptedTransport thenReceive(String line) {
    inbound.add(line);
    return this;
  }

  ScriptedTransport thenFail(IOException failure) {
    inbound.add(failure);
    return this;
  }

  /** Every read advances the clock by {@code millis} before returning. */
  ScriptedTransport readsTake(long millis) {
    this.millisPerRead = millis;
    return this;
  }

  /** The send with zero-based index {@code index} fails. */
  ScriptedTransport failSendAt(int index) {
    this.failSendAt = index;
    return this;
  }

  @Override
  public void sendLine(String line, Duration timeout) throws IOException {
    if (sent.size() == failSendAt) {
      failSendAt = -1;
      throw new IOException("broken pipe");
    }
    sent.add(line);
  }

  @Override
  public String readLine(Duration timeout) throws IOException {
    if (millisPerRead > 0) {
      clock.advance(millisPerRead);
    }
    Object next = inbound.poll();
    if (next == null) {
      if (millisPerRead > 0) {
        throw new SocketTimeoutException("read timed out");
      }
      throw new EOFException("connection closed by server");
    }
    if (next instanceof IOException failure) {
      throw failure;
    }
    return (String) next;
  }

  @Override
  public void close() {
    closeCount++;
  }

  List<String> sent() {
    return sent;
  }

  int closeCount() {
    return closeCount;
  }
}
