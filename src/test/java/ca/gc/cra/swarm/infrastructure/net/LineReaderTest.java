package ca.gc.cra.swarm.infrastructure.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.Test;

class LineReaderTest {

  @Test
  void splitsLinesAndDropsCarriageReturns() throws IOException {
    LineReader reader = reader("first\r\nsecond\n\nthird", 1024);

    assertEquals("first", reader.readLine());
    assertEquals("second", reader.readLine());
    assertEquals("", reader.readLine());
    assertEquals("third", reader.readLine());
    TransportException eof = assertThrows(TransportException.class, reader::readLine);
    assertEquals(TransportException.Kind.EOF, eof.kind());
  }

  @Test
  void decodesUtf8AcrossChunkBoundaries() throws IOException {
    String text = "x".repeat(8191) + "été\n";
    LineReader reader = reader(text, 16_384);

    assertEquals("x".repeat(8191) + "été", reader.readLine());
  }

  @Test
  void oversizedLineIsRejected() {
    LineReader reader = reader("a".repeat(300) + "\n", 256);

    TransportException error = assertThrows(TransportException.class, reader::readLine);
    assertEquals(TransportException.Kind.OVERSIZED, error.kind());
  }

  @Test
  void lineAtTheLimitIsAccepted() throws IOException {
    LineReader reader = reader("b".repeat(256) + "\n", 256);

    assertEquals(256, reader.readLine().length());
  }

  @Test
  void partialLineSurvivesATimeout() throws IOException {
    ChunkedInput in = new ChunkedInput(List.of("{\"type\":", ChunkedInput.TIMEOUT, "\"x\"}\n"));
    LineReader reader = new LineReader(in, 1024);

    assertThrows(SocketTimeoutException.class, reader::readLine);
    assertEquals("{\"type\":\"x\"}", reader.readLine());
  }

  private static LineReader reader(String text, int maxLineBytes) {
    return new LineReader(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), maxLineBytes);
  }

  /** Returns one scripted chunk per read; the {@link #TIMEOUT} marker throws instead. */
  private static final class ChunkedInput extends InputStream {
    static final String TIMEOUT = "<timeout>";
    private final Deque<String> chunks;

    ChunkedInput(List<String> chunks) {
      this.chunks = new ArrayDeque<>(chunks);
    }

    @Override
    public int read() {
      throw new UnsupportedOperationException();
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
      String next = chunks.poll();
      if (next == null) {
        return -1;
      }
      if (TIMEOUT.equals(next)) {
        throw new SocketTimeoutException("Read timed out");
      }
      byte[] bytes = next.getBytes(StandardCharsets.UTF_8);
      System.arraycopy(bytes, 0, buffer, offset, bytes.length);
      return bytes.length;
    }
  }
}
