package ca.gc.cra.swarm.domain.protocol;

import java.util.Objects;

/**
 * Immutable username/password pair derived deterministically from a session id.
 *
 * @param username derived username ({@code usernamePrefix + id})
 * @param password derived password ({@code passwordPrefix + id})
 * @since 0.1.0
 */
public record Credentials(String username, String password) {
  public Credentials {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    if (username.isBlank()) {
      throw new IllegalArgumentException("username must not be blank");
    }
  }

  /**
   * Derives the credentials for a session id.
   *
   * @param usernamePrefix prefix prepended to the id to form the username
   * @param passwordPrefix prefix prepended to the id to form the password
   * @param id sequential session id
   * @return derived credentials
   */
  public static Credentials derive(String usernamePrefix, String passwordPrefix, long id) {
    if (id < 0) {
      throw new IllegalArgumentException("id must be >= 0");
    }
    return new Credentials(
        Objects.requireNonNull(usernamePrefix, "usernamePrefix") + id,
        Objects.requireNonNull(passwordPrefix, "passwordPrefix") + id);
  }

  @Override
  public String toString() {
    return "Credentials[username=" + username + ", password=[REDACTED]]";
  }
}
