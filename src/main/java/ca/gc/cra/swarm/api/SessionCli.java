package ca.gc.cra.swarm.api;

import ca.gc.cra.swarm.application.harness.RunSummary;
import ca.gc.cra.swarm.application.port.OutcomeCounters;
import ca.gc.cra.swarm.application.port.SessionTransport;
import ca.gc.cra.swarm.application.port.TransportConnector;
import ca.gc.cra.swarm.application.session.SessionFactory;
import ca.gc.cra.swarm.application.session.SessionPlan;
import ca.gc.cra.swarm.config.CompositionRoot;
import ca.gc.cra.swarm.config.SessionConfig;
import ca.gc.cra.swarm.infrastructure.net.SocketTransportConnector;
import ca.gc.cra.swarm.logging.LoggingConfigurator;
import ca.gc.cra.swarm.logging.Logs;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI for the {@code play} and {@code register} commands.
 *
 * <p>{@code play} drives every session through registration, join and betting. {@code register} stops each
 * session after registration, flooding the server with new players.</p>
 */
public final class SessionCli {
  private static final Logger log = LoggerFactory.getLogger(SessionCli.class);
  private static final String OPTIONS = """
      Options:
        server=HOST:PORT          Game server TCP endpoint (default localhost:8083)
        players=N                 Sessions to launch, 1..100000000 (default 100)
        concurrency=N             Maximum simultaneously active sessions, 1..10000 (default 100)
        usernamePrefix=TEXT       Username prefix; the session id is appended (default swarm-)
        passwordPrefix=TEXT       Password prefix; the session id is appended (default password)
        firstId=N                 Id of the first session (default 0)
        connectTimeoutMs=N        TCP connect timeout (default 10000)
        ioTimeoutMs=N             Per read/write timeout (default 10000)
        activityTimeoutMs=N       Maximum wait for game events after joining (default 60000)
        maxLineBytes=N            Largest accepted server line (default 1048576)
        progressEvery=N           Log progress every N launches, 0 disables (default 100)
        startDelayMs=N            Pause before the first launch (default 0)
        config=PATH               YAML file with common/play/register sections
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V,...  Extra OTel resource attributes
        --dry-run                 Validate and print the plan without connecting
        --verbose                 Enable DEBUG logging, including every protocol message
        --help                    Show this message
      """;

  private SessionCli() {}

  static ExitCode run(String[] args, SessionPlan plan) {
    return run(args, plan, CompositionRoot::new);
  }

  static ExitCode run(String[] args, SessionPlan plan, Supplier<CompositionRoot> rootFactory) {
    String mode = plan == SessionPlan.PLAY ? "play" : "register";
    String usage = "usage: swarm " + mode + " [server=HOST:PORT] [players=N] [concurrency=N] [key=value ...] "
        + "[--dry-run] [--verbose]";

    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(helpText(plan).stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} CLI", mode);
    }

    ConfigCliUtils.Loaded loaded = ConfigCliUtils.loadEffectiveConfig(mode, input, usage, log);
    if (!loaded.ok()) {
      return loaded.failure();
    }
    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(loaded.effective(), "dryRun");

    Map<String, String> configInputs = new LinkedHashMap<>(loaded.effective());
    configInputs.remove("dryRun");
    String metricsExporter;
    SessionConfig config;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = SessionConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(mode, config, metricsExporter);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = rootFactory.get()) {
      InetSocketAddress server;
      try {
        server = root.resolveServer(config);
      } catch (UnknownHostException ex) {
        log.error("Cannot resolve game server {}: {}", config.serverLabel(), ex.getMessage());
        return ExitCode.IO_ERROR;
      }
      log.info("Configured {} run: server={}, players={}, concurrency={}, metricsExporter={}",
          mode, config.serverLabel(), config.players(), config.concurrency(), metricsExporter);
      if (!config.startDelay().isZero()) {
        log.info("Waiting {} ms before launching sessions", config.startDelay().toMillis());
        Thread.sleep(config.startDelay().toMillis());
      }

      OutcomeCounters counters = root.outcomeCounters();
      RunSummary summary;
      try (SocketTransportConnector connector = root.transportConnector(config)) {
        if (!serverReachable(connector, server, config)) {
          return ExitCode.IO_ERROR;
        }
        SessionFactory factory = root.sessionFactory(config, plan, server, connector, counters);
        summary = root.sessionHarness(config, counters).run(factory, config.firstId(), config.players());
      }
      CliPrinter.printSection("SWARM " + mode + " summary",
          RunReport.sessionRows(summary, plan == SessionPlan.PLAY
              ? RunReport.PLAY_COUNTERS
              : RunReport.REGISTER_COUNTERS));
      return summary.interrupted() ? ExitCode.INTERRUPTED : ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("{} run interrupted before launching sessions", mode);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {} run", mode, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static boolean serverReachable(
      TransportConnector connector, InetSocketAddress server, SessionConfig config) {
    try (SessionTransport transport = connector.open(server, config.connectTimeout())) {
      log.debug("Game server {} accepts connections", config.serverLabel());
      return true;
    } catch (IOException ex) {
      log.error("Cannot reach game server {}: {}", config.serverLabel(), ex.getMessage());
      return false;
    }
  }

  private static void printDryRunPlan(String mode, SessionConfig config, String metricsExporter) {
    Map<String, String> rows = new LinkedHashMap<>();
    rows.put("Server", config.serverLabel());
    rows.put("Players", Long.toString(config.players()));
    rows.put("Concurrency", Integer.toString(config.concurrency()));
    rows.put("First username", config.usernamePrefix() + config.firstId());
    rows.put("Last username", config.usernamePrefix() + (config.firstId() + config.players() - 1));
    rows.put("Password prefix", Logs.redact(config.passwordPrefix()));
    rows.put("Connect timeout", config.connectTimeout().toMillis() + " ms");
    rows.put("I/O timeout", config.ioTimeout().toMillis() + " ms");
    if ("play".equals(mode)) {
      rows.put("Activity timeout", config.activityTimeout().toMillis() + " ms");
    }
    rows.put("Max line bytes", Integer.toString(config.maxLineBytes()));
    rows.put("Start delay", config.startDelay().toMillis() + " ms");
    rows.put("Metrics exporter", metricsExporter);
    CliPrinter.printSection("SWARM " + mode + " dry-run: no connections will be opened.", rows);
    CliPrinter.println(" Re-run without --dry-run to start the sessions.");
  }

  private static String helpText(SessionPlan plan) {
    String header = plan == SessionPlan.PLAY
        ? """
          SWARM play: register, join and play many simulated players at once

          Each session registers, joins a table, goes all-in on its first funded turn
          and folds every turn after that, until the game ends or goes quiet.

          Usage:
            swarm play server=HOST:PORT players=N concurrency=N [options]

          """
        : """
          SWARM register: register many new players without joining a game

          Usage:
            swarm register server=HOST:PORT players=N concurrency=N [options]

          """;
    return header + OPTIONS + "\n" + ExitCode.helpSection();
  }
}
