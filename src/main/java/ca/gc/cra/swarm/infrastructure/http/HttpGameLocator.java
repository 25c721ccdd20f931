package ca.gc.cra.swarm.infrastructure.http;

import ca.gc.cra.swarm.application.port.GameLocator;
import ca.gc.cra.swarm.infrastructure.json.JsonSupport;
import ca.gc.cra.swarm.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds a player's game by scanning the {@code /api/v0/games} listing.
 *
 * <p>The listing is a JSON array of {@code {"game_id":..,"game_state":{"players":[{"player_id":..}]}}}; every
 * other member is ignored. The first game seating the player wins.</p>
 *
 * @since 0.1.0
 */
public final class HttpGameLocator implements GameLocator {
  private static final Logger log = LoggerFactory.getLogger(HttpGameLocator.class);
  private static final String GAMES_PATH = "/api/v0/games";
  private static final int LOGGED_BODY_BYTES = 256;

  private final HttpClient client;
  private final URI listing;
  private final Duration requestTimeout;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates a locator.
   *
   * @param client shared HTTP client
   * @param baseUrl API base URL without trailing slash
   * @param requestTimeout timeout for the listing request
   */
  public HttpGameLocator(HttpClient client, URI baseUrl, Duration requestTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.listing = URI.create(stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl").toString()) + GAMES_PATH);
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  @Override
  public Optional<String> locate(String playerId) throws IOException, InterruptedException {
    Objects.requireNonNull(playerId, "playerId");
    HttpRequest request = HttpRequest.newBuilder(listing).timeout(requestTimeout).GET().build();
    HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() != 200) {
      throw new IOException("games listing " + listing + " returned status " + response.statusCode()
          + ": " + Logs.truncate(response.body(), LOGGED_BODY_BYTES));
    }

    Object root;
    try {
      root = json.parse(response.body());
    } catch (IllegalArgumentException ex) {
      throw new IOException("games listing " + listing + " is not valid JSON", ex);
    }
    if (!(root instanceof List<?> games)) {
      throw new IOException("games listing " + listing + " is not a JSON array");
    }
    if (games.isEmpty()) {
      log.debug("Games listing is empty");
      return Optional.empty();
    }
    for (Object game : games) {
      if (seats(game, playerId)) {
        Object gameId = JsonSupport.member(game, "game_id");
        if (gameId instanceof String id && !id.isEmpty()) {
          return Optional.of(id);
        }
      }
    }
    return Optional.empty();
  }

  private static boolean seats(Object game, String playerId) {
    Object players = JsonSupport.member(JsonSupport.member(game, "game_state"), "players");
    if (!(players instanceof List<?> seated)) {
      return false;
    }
    for (Object player : seated) {
      if (playerId.equals(JsonSupport.member(player, "player_id"))) {
        return true;
      }
    }
    return false;
  }

  static String stripTrailingSlash(String url) {
    String result = url;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
