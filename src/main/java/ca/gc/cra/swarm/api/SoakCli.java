package ca.gc.cra.swarm.api;

import ca.gc.cra.swarm.application.harness.RunSummary;
import ca.gc.cra.swarm.application.port.OutcomeCounters;
import ca.gc.cra.swarm.config.CompositionRoot;
import ca.gc.cra.swarm.config.SoakConfig;
import ca.gc.cra.swarm.logging.LoggingConfigurator;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI for the {@code soak} command: a fixed population of workers requests one HTTP URL for a fixed duration.
 */
public final class SoakCli {
  private static final Logger log = LoggerFactory.getLogger(SoakCli.class);
  private static final String SUMMARY_USAGE =
      "usage: swarm soak (targetUrl=URL | gameId=ID | targetPlayer=ID) [baseUrl=URL] [workers=N] "
          + "[durationSeconds=N] [key=value ...] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      SWARM soak: flood one HTTP endpoint with GET requests for a fixed duration

      Usage:
        swarm soak targetPlayer=some-bot baseUrl=http://host:8082 [options]

      Target (one required; first match wins):
        targetUrl=URL             Request this URL
        gameId=ID                 Request BASEURL/games/ID
        targetPlayer=ID           Find the game seating this player in BASEURL/api/v0/games, then request it

      Options:
        baseUrl=URL               API base URL (default http://localhost:8082)
        workers=N                 Concurrent workers, 1..100000 (default 50)
        durationSeconds=N         How long workers keep sending (default 30)
        requestTimeoutMs=N        Per-request timeout (default 10000)
        failureBackoffMs=N        Pause after a transport error (default 50)
        locateAttempts=N          Games listing lookups before giving up (default 100)
        locateRetryDelayMs=N      Pause between lookups (default 1000)
        config=PATH               YAML file with common/soak sections
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V,...  Extra OTel resource attributes
        --dry-run                 Validate and print the plan without sending requests
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private SoakCli() {}

  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new);
  }

  static ExitCode run(String[] args, Supplier<CompositionRoot> rootFactory) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT + "\n" + ExitCode.helpSection().stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for soak CLI");
    }

    ConfigCliUtils.Loaded loaded = ConfigCliUtils.loadEffectiveConfig("soak", input, SUMMARY_USAGE, log);
    if (!loaded.ok()) {
      return loaded.failure();
    }
    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(loaded.effective(), "dryRun");

    Map<String, String> configInputs = new LinkedHashMap<>(loaded.effective());
    configInputs.remove("dryRun");
    String metricsExporter;
    SoakConfig config;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = SoakConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid soak arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, metricsExporter);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = rootFactory.get()) {
      HttpClient client = root.httpClient(config);
      Optional<URI> target = config.fixedTarget();
      if (target.isEmpty()) {
        String player = config.targetPlayer().orElseThrow();
        log.info("Looking for player {} in an active game", player);
        Optional<String> gameId = root.gameSearch(config, client).find(player);
        if (gameId.isEmpty()) {
          log.error("Could not find player {} in any game after {} attempts", player, config.locateAttempts());
          return ExitCode.RUNTIME_FAILURE;
        }
        target = Optional.of(config.gameUrl(gameId.get()));
      }

      log.info("Starting soak of {} with {} workers for {} s; metricsExporter={}",
          target.get(), config.workers(), config.duration().toSeconds(), metricsExporter);
      OutcomeCounters counters = root.outcomeCounters();
      RunSummary summary = root.timedWorkerHarness(config, counters)
          .run(root.requestProbe(config, client, target.get()));
      CliPrinter.printSection("SWARM soak summary for " + target.get(), RunReport.soakRows(summary));
      return summary.interrupted() ? ExitCode.INTERRUPTED : ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Soak interrupted while locating the target game");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in soak run", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(SoakConfig config, String metricsExporter) {
    Map<String, String> rows = new LinkedHashMap<>();
    rows.put("Target", config.fixedTarget()
        .map(URI::toString)
        .orElseGet(() -> "game of player " + config.targetPlayer().orElse("?") + " via " + config.baseUrl()));
    rows.put("Workers", Integer.toString(config.workers()));
    rows.put("Duration", config.duration().toSeconds() + " s");
    rows.put("Request timeout", config.requestTimeout().toMillis() + " ms");
    rows.put("Failure back-off", config.failureBackoff().toMillis() + " ms");
    if (config.fixedTarget().isEmpty()) {
      rows.put("Locate attempts", Integer.toString(config.locateAttempts()));
      rows.put("Locate retry delay", config.locateRetryDelay().toMillis() + " ms");
    }
    rows.put("Metrics exporter", metricsExporter);
    CliPrinter.printSection("SWARM soak dry-run: no requests will be sent.", rows);
    CliPrinter.println(" Re-run without --dry-run to start the soak.");
  }
}
