package ca.gc.cra.swarm.config;

import ca.gc.cra.swarm.application.harness.SessionHarness;
import ca.gc.cra.swarm.application.harness.TimedWorkerHarness;
import ca.gc.cra.swarm.application.port.ClockPort;
import ca.gc.cra.swarm.application.port.MetricsPort;
import ca.gc.cra.swarm.application.port.OutcomeCounters;
import ca.gc.cra.swarm.application.port.ProtocolCodec;
import ca.gc.cra.swarm.application.port.RequestProbe;
import ca.gc.cra.swarm.application.port.TransportConnector;
import ca.gc.cra.swarm.application.session.PlayerSession;
import ca.gc.cra.swarm.application.session.SessionFactory;
import ca.gc.cra.swarm.application.session.SessionPlan;
import ca.gc.cra.swarm.application.session.SessionSettings;
import ca.gc.cra.swarm.application.soak.GameSearch;
import ca.gc.cra.swarm.domain.protocol.Credentials;
import ca.gc.cra.swarm.infrastructure.counters.AtomicOutcomeCounters;
import ca.gc.cra.swarm.infrastructure.http.HttpGameLocator;
import ca.gc.cra.swarm.infrastructure.http.HttpRequestProbe;
import ca.gc.cra.swarm.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.swarm.infrastructure.net.SocketTransportConnector;
import ca.gc.cra.swarm.infrastructure.protocol.JsonProtocolCodec;
import ca.gc.cra.swarm.infrastructure.time.SystemClockAdapter;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires SWARM ports to their production adapters.
 *
 * <p>One root serves one run. Closing it flushes and shuts down the metrics exporter.</p>
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ProtocolCodec codec = new JsonProtocolCodec();

  /** Creates a root that exports metrics as configured through the {@code otel.*} system properties. */
  public CompositionRoot() {
    this(new OpenTelemetryMetricsAdapter(), SystemClockAdapter.INSTANCE);
  }

  /**
   * Creates a root with explicit metrics and clock ports.
   *
   * @param metrics metrics sink
   * @param clock time source
   */
  public CompositionRoot(MetricsPort metrics, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public OutcomeCounters outcomeCounters() {
    return new AtomicOutcomeCounters(metrics);
  }

  /**
   * Resolves the configured server once so sessions do not each perform a DNS lookup.
   *
   * @param config session configuration
   * @return resolved address
   * @throws UnknownHostException when the host cannot be resolved
   */
  public InetSocketAddress resolveServer(SessionConfig config) throws UnknownHostException {
    InetSocketAddress server = config.server();
    return new InetSocketAddress(InetAddress.getByName(server.getHostString()), server.getPort());
  }

  public SocketTransportConnector transportConnector(SessionConfig config) {
    return new SocketTransportConnector(config.maxLineBytes());
  }

  /**
   * Builds the factory creating one session per player id.
   *
   * @param config session configuration
   * @param plan play or register only
   * @param server resolved server address
   * @param connector connection factory shared by all sessions
   * @param counters run-wide counters
   * @return session factory
   */
  public SessionFactory sessionFactory(
      SessionConfig config,
      SessionPlan plan,
      InetSocketAddress server,
      TransportConnector connector,
      OutcomeCounters counters) {
    SessionSettings settings = new SessionSettings(
        server, plan, config.connectTimeout(), config.ioTimeout(), config.activityTimeout());
    return id -> new PlayerSession(
        Credentials.derive(config.usernamePrefix(), config.passwordPrefix(), id),
        settings,
        connector,
        codec,
        counters,
        clock);
  }

  public SessionHarness sessionHarness(SessionConfig config, OutcomeCounters counters) {
    return new SessionHarness(config.concurrency(), config.progressEvery(), counters, metrics, clock);
  }

  public HttpClient httpClient(SoakConfig config) {
    return HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(config.requestTimeout())
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }

  public GameSearch gameSearch(SoakConfig config, HttpClient client) {
    HttpGameLocator locator = new HttpGameLocator(client, config.baseUrl(), config.requestTimeout());
    return new GameSearch(locator, config.locateAttempts(), config.locateRetryDelay());
  }

  public RequestProbe requestProbe(SoakConfig config, HttpClient client, URI target) {
    return new HttpRequestProbe(client, target, config.requestTimeout());
  }

  public TimedWorkerHarness timedWorkerHarness(SoakConfig config, OutcomeCounters counters) {
    return new TimedWorkerHarness(
        config.workers(), config.duration(), config.failureBackoff(), counters, metrics, clock);
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}
