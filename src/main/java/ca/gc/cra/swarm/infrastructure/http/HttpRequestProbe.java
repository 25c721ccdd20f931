package ca.gc.cra.swarm.infrastructure.http;

import ca.gc.cra.swarm.application.port.RequestProbe;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Sends {@code GET} requests to one fixed URL; only {@code 200} counts as success.
 * <p><strong>Thread-safety:</strong> The underlying {@link HttpClient} and the prebuilt request are shared by
 * every soak worker.</p>
 *
 * @since 0.1.0
 */
public final class HttpRequestProbe implements RequestProbe {
  private static final int HTTP_OK = 200;

  private final HttpClient client;
  private final HttpRequest request;

  /**
   * Creates a probe.
   *
   * @param client shared HTTP client
   * @param target URL requested by every call
   * @param requestTimeout per-request timeout
   */
  public HttpRequestProbe(HttpClient client, URI target, Duration requestTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.request = HttpRequest.newBuilder(Objects.requireNonNull(target, "target"))
        .timeout(Objects.requireNonNull(requestTimeout, "requestTimeout"))
        .GET()
        .build();
  }

  @Override
  public boolean send() throws IOException, InterruptedException {
    HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
    return response.statusCode() == HTTP_OK;
  }
}
