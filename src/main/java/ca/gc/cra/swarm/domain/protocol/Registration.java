package ca.gc.cra.swarm.domain.protocol;

import java.util.Objects;

/**
 * Registration (or login) request carrying the session credentials.
 *
 * @param username player identifier the server will echo back in betting turns
 * @param password clear-text password; never rendered by {@link #toString()}
 * @since 0.1.0
 */
public record Registration(String username, String password) implements Request {
  public Registration {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
  }

  /**
   * Builds the registration request for the supplied credentials.
   *
   * @param credentials session credentials
   * @return registration request
   */
  public static Registration of(Credentials credentials) {
    Objects.requireNonNull(credentials, "credentials");
    return new Registration(credentials.username(), credentials.password());
  }

  @Override
  public String toString() {
    return "Registration[username=" + username + ", password=[REDACTED]]";
  }
}
