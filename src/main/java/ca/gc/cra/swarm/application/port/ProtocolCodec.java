package ca.gc.cra.swarm.application.port;

import ca.gc.cra.swarm.domain.protocol.Request;
import ca.gc.cra.swarm.domain.protocol.ServerResponse;
import java.io.IOException;

/**
 * <strong>What:</strong> Converts protocol messages to and from single wire lines.
 * <p>Encoded lines never contain the terminator; the transport appends it. Decoding skips unknown fields
 * and leaves absent fields at their zero values.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface ProtocolCodec {
  /**
   * Encodes {@code request} as one line.
   *
   * @param request outbound message
   * @return deterministic single-line encoding
   */
  String encode(Request request);

  /**
   * Decodes one inbound line.
   *
   * @param line line without terminator
   * @return decoded message
   * @throws IOException when the line is not a well-formed message object
   */
  ServerResponse decode(String line) throws IOException;
}
