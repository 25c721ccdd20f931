package ca.gc.cra.swarm.infrastructure.protocol;

import ca.gc.cra.swarm.application.port.ProtocolCodec;
import ca.gc.cra.swarm.domain.protocol.Action;
import ca.gc.cra.swarm.domain.protocol.PlayerSnapshot;
import ca.gc.cra.swarm.domain.protocol.Registration;
import ca.gc.cra.swarm.domain.protocol.Request;
import ca.gc.cra.swarm.domain.protocol.ServerResponse;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * <strong>What:</strong> Line-delimited JSON codec for the game server protocol, built on Jackson streaming.
 * <p><strong>Encoding:</strong> registrations are {@code {"username":..,"password":..}}; actions are
 * {@code {"action":..}} with an {@code "amount"} member for bets and folds. Field order is fixed, so equal
 * requests always encode to equal lines.</p>
 * <p><strong>Decoding:</strong> reads {@code type}, {@code event}, {@code code}, {@code message},
 * {@code game_id}, {@code stage}, {@code state.player.{player_id,chips}} and {@code minimum_bet}. Unknown
 * members are skipped, absent or {@code null} members keep their zero value, and the {@code event} subtree is
 * kept as raw JSON text. A bare {@code null} line decodes to {@link ServerResponse#EMPTY}. Anything other than
 * exactly one JSON object, or a member of the wrong JSON type, fails with {@link ProtocolDecodeException}.</p>
 * <p><strong>Thread-safety:</strong> {@link JsonFactory} is thread-safe; parsers and generators are per call.</p>
 *
 * @since 0.1.0
 */
public final class JsonProtocolCodec implements ProtocolCodec {
  private final JsonFactory factory = new JsonFactory();

  @Override
  public String encode(Request request) {
    Objects.requireNonNull(request, "request");
    StringWriter out = new StringWriter(64);
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartObject();
      if (request instanceof Registration registration) {
        generator.writeStringField("username", registration.username());
        generator.writeStringField("password", registration.password());
      } else if (request instanceof Action action) {
        generator.writeStringField("action", action.verb());
        if (action.wireAmount().isPresent()) {
          generator.writeNumberField("amount", action.wireAmount().getAsLong());
        }
      }
      generator.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode " + request.getClass().getSimpleName(), ex);
    }
    return out.toString();
  }

  @Override
  public ServerResponse decode(String line) throws IOException {
    if (line == null || line.isBlank()) {
      throw new ProtocolDecodeException("empty line");
    }
    try (JsonParser parser = factory.createParser(line)) {
      JsonToken first = parser.nextToken();
      ServerResponse response;
      if (first == JsonToken.VALUE_NULL) {
        response = ServerResponse.EMPTY;
      } else if (first == JsonToken.START_OBJECT) {
        response = readResponse(parser);
      } else {
        throw new ProtocolDecodeException("expected a JSON object");
      }
      JsonToken trailing = parser.nextToken();
      if (trailing != null) {
        throw new ProtocolDecodeException("trailing content after JSON object");
      }
      return response;
    } catch (JsonProcessingException ex) {
      throw new ProtocolDecodeException("malformed JSON: " + ex.getOriginalMessage(), ex);
    }
  }

  private ServerResponse readResponse(JsonParser parser) throws IOException {
    String type = null;
    String eventJson = null;
    long code = 0L;
    String message = null;
    String gameId = null;
    String stage = null;
    PlayerSnapshot player = null;
    long minimumBet = 0L;

    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case "type" -> type = readString(parser, field);
        case "event" -> eventJson = readRaw(parser);
        case "code" -> code = readLong(parser, field);
        case "message" -> message = readString(parser, field);
        case "game_id" -> gameId = readString(parser, field);
        case "stage" -> stage = readString(parser, field);
        case "state" -> player = readState(parser);
        case "minimum_bet" -> minimumBet = readLong(parser, field);
        default -> {
          if (value.isStructStart()) {
            parser.skipChildren();
          }
        }
      }
    }
    return new ServerResponse(type, eventJson, code, message, gameId, stage, player, minimumBet);
  }

  private PlayerSnapshot readState(JsonParser parser) throws IOException {
    if (parser.currentToken() == JsonToken.VALUE_NULL) {
      return null;
    }
    expectObject(parser, "state");
    PlayerSnapshot player = null;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      if ("player".equals(field)) {
        player = readPlayer(parser);
      } else if (value.isStructStart()) {
        parser.skipChildren();
      }
    }
    return player;
  }

  private PlayerSnapshot readPlayer(JsonParser parser) throws IOException {
    if (parser.currentToken() == JsonToken.VALUE_NULL) {
      return null;
    }
    expectObject(parser, "state.player");
    String playerId = null;
    long chips = 0L;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case "player_id" -> playerId = readString(parser, field);
        case "chips" -> chips = readLong(parser, field);
        default -> {
          if (value.isStructStart()) {
            parser.skipChildren();
          }
        }
      }
    }
    return new PlayerSnapshot(playerId, chips);
  }

  private String readRaw(JsonParser parser) throws IOException {
    if (parser.currentToken() == JsonToken.VALUE_NULL) {
      return null;
    }
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.copyCurrentStructure(parser);
    }
    return out.toString();
  }

  private static String readString(JsonParser parser, String field) throws IOException {
    JsonToken token = parser.currentToken();
    if (token == JsonToken.VALUE_NULL) {
      return null;
    }
    if (token != JsonToken.VALUE_STRING) {
      throw new ProtocolDecodeException("field '" + field + "' must be a string but was " + token);
    }
    return parser.getText();
  }

  private static long readLong(JsonParser parser, String field) throws IOException {
    JsonToken token = parser.currentToken();
    if (token == JsonToken.VALUE_NULL) {
      return 0L;
    }
    if (token != JsonToken.VALUE_NUMBER_INT) {
      throw new ProtocolDecodeException("field '" + field + "' must be an integer but was " + token);
    }
    return parser.getLongValue();
  }

  private static void expectObject(JsonParser parser, String field) throws ProtocolDecodeException {
    if (parser.currentToken() != JsonToken.START_OBJECT) {
      throw new ProtocolDecodeException("field '" + field + "' must be an object but was " + parser.currentToken());
    }
  }
}
