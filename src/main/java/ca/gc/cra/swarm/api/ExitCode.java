package ca.gc.cra.swarm.api;

/**
 * Process exit codes returned by the SWARM commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0, "run completed; counters printed"),
  INVALID_ARGS(2, "invalid arguments or configuration values"),
  IO_ERROR(3, "configuration file unreadable or game server unreachable"),
  RUNTIME_FAILURE(5, "run could not start or failed unexpectedly"),
  INTERRUPTED(130, "run interrupted; partial counters printed");

  private final int code;
  private final String description;

  ExitCode(int code, String description) {
    this.code = code;
    this.description = description;
  }

  /**
   * Returns the numeric process exit status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }

  /**
   * Returns the one-line meaning shown in help output.
   *
   * @return description
   */
  public String description() {
    return description;
  }

  static String helpSection() {
    StringBuilder text = new StringBuilder("Exit codes:\n");
    for (ExitCode exit : values()) {
      text.append(String.format("  %-4d %s%n", exit.code, exit.description));
    }
    return text.toString();
  }
}
