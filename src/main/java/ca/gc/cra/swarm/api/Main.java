package ca.gc.cra.swarm.api;

import ca.gc.cra.swarm.application.session.SessionPlan;
import ca.gc.cra.swarm.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SWARM entry point dispatching to the {@code play}, {@code register} and {@code soak} commands.
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: swarm <play|register|soak> [key=value ...] [--dry-run]";
  private static final String HELP_TEXT = """
      SWARM load driver for the poker game server

      Usage:
        swarm <command> [options]

      Commands:
        play        Register, join and play many simulated players (play --help for details)
        register    Register many players without joining a game
        soak        Flood one HTTP endpoint for a fixed duration

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String command = input.command();
    if (command.isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String[] delegateArgs = input.subcommandArgs();
    return switch (command) {
      case "play" -> SessionCli.run(delegateArgs, SessionPlan.PLAY);
      case "register" -> SessionCli.run(delegateArgs, SessionPlan.REGISTER_ONLY);
      case "soak" -> SoakCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
