package ca.gc.cra.swarm.infrastructure.net;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Splits a byte stream into {@code \n} terminated UTF-8 lines with an upper bound on line length.
 *
 * <p>A trailing {@code \r} is dropped. Bytes of a partially read line survive a read timeout, so a later call
 * resumes the same line. A final unterminated line is returned at end of stream; the call after that fails
 * with {@link TransportException.Kind#EOF}.</p>
 */
final class LineReader {
  private static final int CHUNK_BYTES = 8192;

  private final InputStream in;
  private final int maxLineBytes;
  private final byte[] chunk = new byte[CHUNK_BYTES];
  private final ByteArrayOutputStream pending = new ByteArrayOutputStream(256);
  private int position;
  private int limit;

  LineReader(InputStream in, int maxLineBytes) {
    if (maxLineBytes <= 0) {
      throw new IllegalArgumentException("maxLineBytes must be positive");
    }
    this.in = in;
    this.maxLineBytes = maxLineBytes;
  }

  String readLine() throws IOException {
    while (true) {
      if (position == limit) {
        int read = in.read(chunk);
        if (read < 0) {
          if (pending.size() == 0) {
            throw new TransportException(TransportException.Kind.EOF, "connection closed by server");
          }
          return takeLine();
        }
        position = 0;
        limit = read;
      }
      int start = position;
      while (position < limit && chunk[position] != '\n') {
        position++;
      }
      int length = position - start;
      if (pending.size() + length > maxLineBytes) {
        pending.reset();
        throw new TransportException(
            TransportException.Kind.OVERSIZED, "inbound line exceeds " + maxLineBytes + " bytes");
      }
      pending.write(chunk, start, length);
      if (position < limit) {
        position++;
        return takeLine();
      }
    }
  }

  private String takeLine() {
    byte[] bytes = pending.toByteArray();
    pending.reset();
    int end = bytes.length;
    if (end > 0 && bytes[end - 1] == '\r') {
      end--;
    }
    return new String(bytes, 0, end, StandardCharsets.UTF_8);
  }
}
