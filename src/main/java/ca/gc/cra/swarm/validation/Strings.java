package ca.gc.cra.swarm.validation;

import java.util.Objects;

/**
 * String validation helpers for user supplied configuration.
 *
 * @since 0.1.0
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Trims {@code value} and rejects blank or control-character content.
   *
   * @param name field name used in error messages
   * @param value raw value
   * @return trimmed value
   * @throws NullPointerException when {@code value} is {@code null}
   * @throws IllegalArgumentException when blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a value that is embedded verbatim in protocol messages, such as a credential prefix.
   * Empty values are allowed; every character must be printable ASCII.
   *
   * @param name field name used in error messages
   * @param value raw value; {@code null} is treated as empty
   * @param maxLength maximum length
   * @return the value unchanged
   * @throws IllegalArgumentException when too long or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String candidate = value == null ? "" : value;
    if (candidate.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < candidate.length(); i++) {
      char c = candidate.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return candidate;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
