package ca.gc.cra.swarm.application.session;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Per-session connection and timing parameters shared by every session of a run.
 *
 * @param server game server address
 * @param plan how far each session drives the protocol
 * @param connectTimeout bound on establishing the connection
 * @param ioTimeout bound on each individual read or write
 * @param activityTimeout bound on the total time spent in {@link SessionState#INTERACTING}
 * @since 0.1.0
 */
public record SessionSettings(
    InetSocketAddress server,
    SessionPlan plan,
    Duration connectTimeout,
    Duration ioTimeout,
    Duration activityTimeout) {

  public SessionSettings {
    Objects.requireNonNull(server, "server");
    Objects.requireNonNull(plan, "plan");
    requirePositive("connectTimeout", connectTimeout);
    requirePositive("ioTimeout", ioTimeout);
    requirePositive("activityTimeout", activityTimeout);
  }

  private static void requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
